package com.ryuqq.stdlib.core.doblock;

import com.ryuqq.stdlib.core.monad.Kind;

import java.util.function.Function;

/**
 * do-block 프로그램의 한 단계.
 *
 * <p>프로그램은 중첩된 continuation으로 표현되는 선형 스크립트입니다.
 * 각 단계는 다음 셋 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Bind}: 컨테이너를 내놓고, 풀린 값으로 재개될 continuation을 가짐</li>
 *   <li>{@link Return}: 명시적 조기 반환 (결과를 성공 생성자로 감쌈)</li>
 *   <li>{@link Done}: 마지막으로 평가된 컨테이너 표현식 (그대로 결과가 됨)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Maybe&lt;String&gt; greeting = DoBlock.maybe(() -&gt;
 *     Program.bind(Maybe.of(salutation), a -&gt;
 *     Program.bind(Maybe.of(name), b -&gt;
 *     Program.earlyReturn(a + ", " + b + "!"))));
 * </pre>
 *
 * <p>continuation은 앞 단계가 성공했을 때만 호출되므로, 단락 이후 단계의
 * 표현식은 평가되지 않습니다.</p>
 *
 * @param <W> 컨테이너 계열 witness
 * @param <R> 프로그램 결과 타입
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public sealed interface Program<W, R> permits Program.Bind, Program.Return, Program.Done {

    /**
     * 중단 지점: 컨테이너를 내놓고 풀린 값으로 재개.
     *
     * @param step 이 단계가 내놓는 컨테이너
     * @param resume 풀린 값을 받아 나머지 프로그램을 만드는 continuation
     * @param <W> 컨테이너 계열 witness
     * @param <X> 풀린 값 타입
     * @param <R> 프로그램 결과 타입
     */
    record Bind<W, X, R>(
        Kind<W, X> step,
        Function<? super X, ? extends Program<W, R>> resume
    ) implements Program<W, R> {

        public Bind {
            if (step == null) {
                throw new IllegalArgumentException("step cannot be null");
            }
            if (resume == null) {
                throw new IllegalArgumentException("resume cannot be null");
            }
        }
    }

    /**
     * 명시적 조기 반환.
     *
     * @param value 반환 값
     * @param <W> 컨테이너 계열 witness
     * @param <R> 프로그램 결과 타입
     */
    record Return<W, R>(R value) implements Program<W, R> {
    }

    /**
     * 마지막 컨테이너 표현식.
     *
     * @param result 프로그램의 결과 컨테이너
     * @param <W> 컨테이너 계열 witness
     * @param <R> 프로그램 결과 타입
     */
    record Done<W, R>(Kind<W, R> result) implements Program<W, R> {

        public Done {
            if (result == null) {
                throw new IllegalArgumentException("result cannot be null");
            }
        }
    }

    /**
     * 중단 지점 생성.
     *
     * @param step 내놓을 컨테이너
     * @param resume 풀린 값으로 재개할 continuation
     * @param <W> 컨테이너 계열 witness
     * @param <X> 풀린 값 타입
     * @param <R> 프로그램 결과 타입
     * @return Bind 단계
     */
    static <W, X, R> Program<W, R> bind(Kind<W, X> step, Function<? super X, ? extends Program<W, R>> resume) {
        return new Bind<>(step, resume);
    }

    /**
     * 조기 반환 생성.
     *
     * @param value 반환 값
     * @param <W> 컨테이너 계열 witness
     * @param <R> 프로그램 결과 타입
     * @return Return 단계
     */
    static <W, R> Program<W, R> earlyReturn(R value) {
        return new Return<>(value);
    }

    /**
     * 마지막 컨테이너 표현식으로 프로그램 종료.
     *
     * @param result 결과 컨테이너
     * @param <W> 컨테이너 계열 witness
     * @param <R> 프로그램 결과 타입
     * @return Done 단계
     */
    static <W, R> Program<W, R> last(Kind<W, R> result) {
        return new Done<>(result);
    }
}
