package com.ryuqq.stdlib.core.maybe;

import com.ryuqq.stdlib.core.either.Either;
import com.ryuqq.stdlib.core.monad.Kind;
import com.ryuqq.stdlib.core.monad.Monad;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 값이 있거나({@link Some}) 없음({@link Nothing})을 나타내는 컨테이너.
 *
 * <p>부재는 실패가 아니라 값입니다. 이 타입의 어떤 연산도 부재 때문에 예외를
 * 던지지 않으며, 값을 꺼낼 때는 {@link #getOrElse}나 {@link #mapOr}처럼
 * 기본값을 받는 연산을 사용합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>정확히 하나의 variant만 활성</li>
 *   <li>{@link Some}은 항상 null이 아닌 값을 가짐</li>
 *   <li>{@link Nothing}은 payload가 없음</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * String greeting = Maybe.of(System.getenv("USER"))
 *     .map(user -&gt; "Hello, " + user)
 *     .getOrElse("Hello, stranger");
 * </pre>
 *
 * @param <T> 값 타입
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public sealed interface Maybe<T> extends Kind<Maybe.Mu, T> permits Some, Nothing {

    /**
     * Maybe 계열의 witness 타입.
     */
    final class Mu {
        private Mu() {
        }
    }

    /**
     * nullable 값으로부터 생성.
     *
     * @param value 값 (null 허용)
     * @param <T> 값 타입
     * @return value가 null이면 Nothing, 아니면 Some
     */
    static <T> Maybe<T> of(T value) {
        return value == null ? nothing() : new Some<>(value);
    }

    /**
     * 값이 있는 Maybe 생성.
     *
     * @param value 값
     * @param <T> 값 타입
     * @return Some 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <T> Maybe<T> some(T value) {
        return new Some<>(value);
    }

    /**
     * 값이 없는 Maybe.
     *
     * @param <T> 값 타입
     * @return Nothing 인스턴스
     */
    static <T> Maybe<T> nothing() {
        return Nothing.instance();
    }

    /**
     * {@link Optional}로부터 변환.
     *
     * @param optional 원본 Optional
     * @param <T> 값 타입
     * @return 대응하는 Maybe
     * @throws IllegalArgumentException optional이 null인 경우
     */
    static <T> Maybe<T> fromOptional(Optional<T> optional) {
        if (optional == null) {
            throw new IllegalArgumentException("optional cannot be null");
        }
        return of(optional.orElse(null));
    }

    /**
     * Maybe 계열의 {@link Monad} 구현.
     *
     * @return Maybe monad
     */
    static Monad<Mu> monad() {
        return MaybeMonad.INSTANCE;
    }

    /**
     * {@link Kind}를 구체 타입으로 복원.
     *
     * @param kind Maybe 계열 Kind
     * @param <T> 값 타입
     * @return Maybe 인스턴스
     */
    static <T> Maybe<T> narrow(Kind<Mu, T> kind) {
        return (Maybe<T>) kind;
    }

    /**
     * 값이 있는지 확인.
     *
     * @return Some이면 true
     */
    default boolean isSome() {
        return this instanceof Some;
    }

    /**
     * 값이 없는지 확인.
     *
     * @return Nothing이면 true
     */
    default boolean isNothing() {
        return this instanceof Nothing;
    }

    /**
     * 값 변환.
     *
     * <p>변환 결과가 null이면 Nothing이 됩니다 ({@link Optional#map}과 동일).
     * Nothing에 대해서는 mapper를 호출하지 않습니다.</p>
     *
     * @param mapper 변환 함수
     * @param <U> 결과 타입
     * @return 변환된 Maybe
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    default <U> Maybe<U> map(Function<? super T, ? extends U> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (this instanceof Some<T> some) {
            return of(mapper.apply(some.value()));
        }
        return nothing();
    }

    /**
     * 값을 다음 Maybe 계산에 연결.
     *
     * @param mapper Maybe를 반환하는 함수
     * @param <U> 결과 타입
     * @return mapper의 결과, 또는 Nothing
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    default <U> Maybe<U> flatMap(Function<? super T, ? extends Maybe<U>> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (this instanceof Some<T> some) {
            return mapper.apply(some.value());
        }
        return nothing();
    }

    /**
     * 조건을 만족하는 값만 유지.
     *
     * @param predicate 조건
     * @return 조건을 만족하면 자신, 아니면 Nothing
     */
    default Maybe<T> filter(Predicate<? super T> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        if (this instanceof Some<T> some && predicate.test(some.value())) {
            return this;
        }
        return nothing();
    }

    /**
     * 값 또는 기본값.
     *
     * @param defaultValue 기본값
     * @return Some이면 값, 아니면 defaultValue
     */
    default T getOrElse(T defaultValue) {
        if (this instanceof Some<T> some) {
            return some.value();
        }
        return defaultValue;
    }

    /**
     * 값 또는 지연 계산된 기본값.
     *
     * @param supplier 기본값 공급자 (Nothing일 때만 호출)
     * @return Some이면 값, 아니면 supplier 결과
     */
    default T getOrElseGet(Supplier<? extends T> supplier) {
        if (this instanceof Some<T> some) {
            return some.value();
        }
        return supplier.get();
    }

    /**
     * 값을 변환하거나 기본값으로 제거.
     *
     * @param defaultValue Nothing일 때의 결과
     * @param mapper Some일 때 적용할 함수
     * @param <U> 결과 타입
     * @return 변환 결과 또는 defaultValue
     */
    default <U> U mapOr(U defaultValue, Function<? super T, ? extends U> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (this instanceof Some<T> some) {
            return mapper.apply(some.value());
        }
        return defaultValue;
    }

    /**
     * 값이 없을 때 대체 Maybe 사용.
     *
     * @param alternative 대체 Maybe
     * @return Some이면 자신, 아니면 alternative
     */
    default Maybe<T> orElse(Maybe<T> alternative) {
        return isSome() ? this : alternative;
    }

    /**
     * 값이 있을 때만 동작 수행.
     *
     * @param action 수행할 동작
     */
    default void ifSome(Consumer<? super T> action) {
        if (this instanceof Some<T> some) {
            action.accept(some.value());
        }
    }

    /**
     * Either로 변환.
     *
     * @param left Nothing일 때 사용할 Left 값
     * @param <L> Left 타입
     * @return Some이면 Right, 아니면 Left(left)
     */
    default <L> Either<L, T> toEither(L left) {
        if (this instanceof Some<T> some) {
            return Either.right(some.value());
        }
        return Either.left(left);
    }

    /**
     * {@link Optional}로 변환.
     *
     * @return 대응하는 Optional
     */
    default Optional<T> toOptional() {
        if (this instanceof Some<T> some) {
            return Optional.of(some.value());
        }
        return Optional.empty();
    }
}
