package com.ryuqq.stdlib.core.either;

import com.ryuqq.stdlib.core.maybe.Maybe;
import com.ryuqq.stdlib.core.maybe.Some;
import com.ryuqq.stdlib.core.monad.Kind;
import com.ryuqq.stdlib.core.monad.Monad;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 성공({@link Right}) 또는 실패({@link Left})를 나타내는 두 갈래 컨테이너.
 *
 * <p>관례상 Right가 성공/계속 채널, Left가 실패/단락 채널입니다.
 * {@link #map}과 {@link #flatMap}은 Right에만 적용되며, Left는 어떤 체인을 거쳐도
 * 같은 값 그대로 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Either&lt;String, Integer&gt; port = Either.&lt;String, String&gt;right("8080")
 *     .flatMap(s -&gt; s.matches("\\d+") ? Either.right(Integer.parseInt(s)) : Either.left("not a number: " + s));
 *
 * String text = port.fold(error -&gt; "invalid: " + error, p -&gt; "port " + p);
 * </pre>
 *
 * @param <L> 실패 값 타입
 * @param <R> 성공 값 타입
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public sealed interface Either<L, R> extends Kind<Either.Mu<L>, R> permits Left, Right {

    /**
     * Left 타입이 고정된 Either 계열의 witness 타입.
     *
     * @param <L> 실패 값 타입
     */
    final class Mu<L> {
        private Mu() {
        }
    }

    /**
     * 실패 생성.
     *
     * @param value 실패 값 (null 허용)
     * @param <L> 실패 값 타입
     * @param <R> 성공 값 타입
     * @return Left 인스턴스
     */
    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    /**
     * 성공 생성.
     *
     * @param value 성공 값 (null 허용)
     * @param <L> 실패 값 타입
     * @param <R> 성공 값 타입
     * @return Right 인스턴스
     */
    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    /**
     * Maybe로부터 변환.
     *
     * @param maybe 원본 Maybe
     * @param left Nothing일 때 Left 값 공급자 (Nothing일 때만 호출)
     * @param <L> 실패 값 타입
     * @param <R> 성공 값 타입
     * @return Some이면 Right, Nothing이면 Left
     * @throws IllegalArgumentException maybe 또는 left가 null인 경우
     */
    static <L, R> Either<L, R> fromMaybe(Maybe<R> maybe, Supplier<? extends L> left) {
        if (maybe == null) {
            throw new IllegalArgumentException("maybe cannot be null");
        }
        if (left == null) {
            throw new IllegalArgumentException("left cannot be null");
        }
        if (maybe instanceof Some<R> some) {
            return right(some.value());
        }
        return left(left.get());
    }

    /**
     * Either 컬렉션을 컬렉션의 Either로 변환.
     *
     * <p>입력 순서대로 처리하며 첫 번째 Left를 만나면 즉시 그 Left를 반환합니다.
     * 이후 원소는 iterator에서 꺼내지 않으므로, 지연 평가되는 Iterable의 남은
     * 원소는 평가되지 않습니다.</p>
     *
     * @param eithers Either 목록
     * @param <L> 실패 값 타입
     * @param <R> 성공 값 타입
     * @return 첫 Left, 또는 모든 Right 값을 입력 순서대로 담은 Right
     * @throws IllegalArgumentException eithers가 null인 경우
     */
    static <L, R> Either<L, List<R>> sequence(Iterable<? extends Either<L, R>> eithers) {
        return Either.<L, Either<L, R>, R>traverse(eithers, Function.identity());
    }

    /**
     * 각 원소에 함수를 적용하며 {@link #sequence}와 같은 방식으로 모음.
     *
     * <p>첫 번째 Left 이후에는 함수를 더 이상 호출하지 않습니다.</p>
     *
     * @param items 입력 원소
     * @param f 원소별 계산
     * @param <L> 실패 값 타입
     * @param <A> 입력 원소 타입
     * @param <B> 결과 원소 타입
     * @return 첫 Left, 또는 모든 결과를 입력 순서대로 담은 Right
     * @throws IllegalArgumentException items 또는 f가 null인 경우
     */
    static <L, A, B> Either<L, List<B>> traverse(Iterable<? extends A> items,
                                                  Function<? super A, ? extends Either<L, B>> f) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }

        List<B> values = new ArrayList<>();
        for (A item : items) {
            Either<L, B> result = f.apply(item);
            if (result instanceof Left<L, B> failure) {
                return left(failure.value());
            }
            values.add(((Right<L, B>) result).value());
        }
        return right(Collections.unmodifiableList(values));
    }

    /**
     * Either 계열의 {@link Monad} 구현.
     *
     * @param <L> 실패 값 타입
     * @return Either monad
     */
    static <L> Monad<Mu<L>> monad() {
        return EitherMonad.instance();
    }

    /**
     * {@link Kind}를 구체 타입으로 복원.
     *
     * @param kind Either 계열 Kind
     * @param <L> 실패 값 타입
     * @param <R> 성공 값 타입
     * @return Either 인스턴스
     */
    static <L, R> Either<L, R> narrow(Kind<Mu<L>, R> kind) {
        return (Either<L, R>) kind;
    }

    /**
     * 실패인지 확인.
     *
     * @return Left이면 true
     */
    default boolean isLeft() {
        return this instanceof Left;
    }

    /**
     * 성공인지 확인.
     *
     * @return Right이면 true
     */
    default boolean isRight() {
        return this instanceof Right;
    }

    /**
     * 성공 값 변환.
     *
     * <p>Left에 대해서는 mapper를 호출하지 않고 같은 인스턴스를 반환합니다.</p>
     *
     * @param mapper 변환 함수
     * @param <U> 결과 타입
     * @return 변환된 Either
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    @SuppressWarnings("unchecked")
    default <U> Either<L, U> map(Function<? super R, ? extends U> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (this instanceof Right<L, R> success) {
            return right(mapper.apply(success.value()));
        }
        return (Either<L, U>) this;
    }

    /**
     * 성공 값을 다음 Either 계산에 연결.
     *
     * <p>Left에 대해서는 mapper를 호출하지 않고 같은 인스턴스를 반환합니다.</p>
     *
     * @param mapper Either를 반환하는 함수
     * @param <U> 결과 타입
     * @return mapper의 결과, 또는 원래 Left
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    @SuppressWarnings("unchecked")
    default <U> Either<L, U> flatMap(Function<? super R, ? extends Either<L, U>> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (this instanceof Right<L, R> success) {
            return mapper.apply(success.value());
        }
        return (Either<L, U>) this;
    }

    /**
     * 실패 값 변환.
     *
     * @param mapper 변환 함수
     * @param <M> 결과 실패 타입
     * @return 변환된 Either (Right는 그대로)
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    @SuppressWarnings("unchecked")
    default <M> Either<M, R> mapLeft(Function<? super L, ? extends M> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (this instanceof Left<L, R> failure) {
            return left(mapper.apply(failure.value()));
        }
        return (Either<M, R>) this;
    }

    /**
     * 두 갈래를 하나의 값으로 제거.
     *
     * @param onLeft Left일 때 적용할 함수
     * @param onRight Right일 때 적용할 함수
     * @param <T> 결과 타입
     * @return 적용 결과
     * @throws IllegalArgumentException 함수가 null인 경우
     */
    default <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
        if (onLeft == null || onRight == null) {
            throw new IllegalArgumentException("onLeft and onRight cannot be null");
        }
        if (this instanceof Right<L, R> success) {
            return onRight.apply(success.value());
        }
        return onLeft.apply(((Left<L, R>) this).value());
    }

    /**
     * 성공 값 또는 기본값.
     *
     * @param defaultValue 기본값
     * @return Right이면 값, 아니면 defaultValue
     */
    default R getOrElse(R defaultValue) {
        if (this instanceof Right<L, R> success) {
            return success.value();
        }
        return defaultValue;
    }

    /**
     * 갈래 교환.
     *
     * @return Left는 Right로, Right는 Left로
     */
    default Either<R, L> swap() {
        if (this instanceof Right<L, R> success) {
            return left(success.value());
        }
        return right(((Left<L, R>) this).value());
    }

    /**
     * Maybe로 변환 (실패 값은 버려짐).
     *
     * @return Right이면 {@code Maybe.of(value)}, 아니면 Nothing
     */
    default Maybe<R> toMaybe() {
        if (this instanceof Right<L, R> success) {
            return Maybe.of(success.value());
        }
        return Maybe.nothing();
    }

    /**
     * 성공일 때만 동작 수행.
     *
     * @param action 수행할 동작
     */
    default void ifRight(Consumer<? super R> action) {
        if (this instanceof Right<L, R> success) {
            action.accept(success.value());
        }
    }

    /**
     * 실패일 때만 동작 수행.
     *
     * @param action 수행할 동작
     */
    default void ifLeft(Consumer<? super L> action) {
        if (this instanceof Left<L, R> failure) {
            action.accept(failure.value());
        }
    }
}
