package com.ryuqq.stdlib.core.doblock;

import com.ryuqq.stdlib.core.either.Either;
import com.ryuqq.stdlib.core.maybe.Maybe;
import com.ryuqq.stdlib.core.monad.Kind;
import com.ryuqq.stdlib.core.monad.Monad;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * do-block 인터프리터.
 *
 * <p>{@link Program}을 처음부터 구동하며 각 {@link Program.Bind}를 컨테이너의
 * {@link Monad#flatMap}으로 연결합니다. 컨테이너가 단락 상태(Nothing, Left)이면
 * flatMap이 continuation을 호출하지 않으므로 계산 전체가 그 상태로 멈춥니다.</p>
 *
 * <p><strong>구동 규칙:</strong></p>
 * <pre>
 * Bind(m, k)  → monad.flatMap(m, x -&gt; drive(k(x)))
 * Return(v)   → monad.unit(v)
 * Done(m)     → m
 * </pre>
 *
 * <p>인터프리터 자체는 도메인 실패로 예외를 던지지 않습니다. 모든 실패는
 * 컨테이너의 단락 갈래로 반환 값에 드러납니다. 사용자 함수가 던진 예외는
 * 그대로 전파됩니다.</p>
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public final class DoBlock {

    private static final Logger log = LoggerFactory.getLogger(DoBlock.class);

    // Utility class - prevent instantiation
    private DoBlock() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 프로그램을 새로 만들어 한 번 구동.
     *
     * @param monad 컨테이너 능력
     * @param program 프로그램 공급자 (실행마다 호출됨)
     * @param <W> 컨테이너 계열 witness
     * @param <R> 결과 타입
     * @return 프로그램 결과 컨테이너
     * @throws IllegalArgumentException monad 또는 program이 null인 경우
     */
    public static <W, R> Kind<W, R> run(Monad<W> monad, Supplier<? extends Program<W, R>> program) {
        if (monad == null) {
            throw new IllegalArgumentException("monad cannot be null");
        }
        if (program == null) {
            throw new IllegalArgumentException("program cannot be null");
        }
        return drive(monad, program.get());
    }

    /**
     * 인자를 받는 do-block 함수 생성.
     *
     * <p>반환된 함수를 호출할 때마다 body로 새 프로그램을 만들어 구동하므로
     * 호출 간에 공유되는 상태가 없습니다.</p>
     *
     * @param monad 컨테이너 능력
     * @param body 인자로 프로그램을 만드는 함수
     * @param <W> 컨테이너 계열 witness
     * @param <A> 인자 타입
     * @param <R> 결과 타입
     * @return do-block 함수
     * @throws IllegalArgumentException monad 또는 body가 null인 경우
     */
    public static <W, A, R> Function<A, Kind<W, R>> of(Monad<W> monad,
                                                       Function<? super A, ? extends Program<W, R>> body) {
        if (monad == null) {
            throw new IllegalArgumentException("monad cannot be null");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return argument -> drive(monad, body.apply(argument));
    }

    /**
     * Maybe 위에서 프로그램 구동.
     *
     * @param program 프로그램 공급자
     * @param <R> 결과 타입
     * @return 결과 Maybe
     */
    public static <R> Maybe<R> maybe(Supplier<? extends Program<Maybe.Mu, R>> program) {
        return Maybe.narrow(run(Maybe.monad(), program));
    }

    /**
     * Either 위에서 프로그램 구동.
     *
     * @param program 프로그램 공급자
     * @param <L> 실패 값 타입
     * @param <R> 결과 타입
     * @return 결과 Either
     */
    public static <L, R> Either<L, R> either(Supplier<? extends Program<Either.Mu<L>, R>> program) {
        return Either.narrow(run(Either.<L>monad(), program));
    }

    private static <W, R> Kind<W, R> drive(Monad<W> monad, Program<W, R> program) {
        if (program == null) {
            throw new IllegalStateException("do-block continuation returned null program");
        }
        if (program instanceof Program.Bind<W, ?, R> bind) {
            return resume(monad, bind);
        }
        if (program instanceof Program.Return<W, R> earlyReturn) {
            log.debug("Do-block returned early with {}", earlyReturn.value());
            return monad.unit(earlyReturn.value());
        }
        return ((Program.Done<W, R>) program).result();
    }

    private static <W, X, R> Kind<W, R> resume(Monad<W> monad, Program.Bind<W, X, R> bind) {
        return monad.flatMap(bind.step(), value -> drive(monad, bind.resume().apply(value)));
    }
}
