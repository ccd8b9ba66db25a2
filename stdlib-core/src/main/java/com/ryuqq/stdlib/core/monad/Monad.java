package com.ryuqq.stdlib.core.monad;

import java.util.function.Function;

/**
 * 컨테이너 계열 {@code W}에 대한 bind 능력.
 *
 * <p>do-block 인터프리터는 이 인터페이스 하나에만 의존하므로
 * {@code Maybe}와 {@code Either} 모두에 동일하게 동작합니다.</p>
 *
 * <p><strong>법칙:</strong></p>
 * <ul>
 *   <li>좌항등: {@code flatMap(unit(a), f) == f(a)}</li>
 *   <li>우항등: {@code flatMap(m, this::unit) == m}</li>
 *   <li>결합: {@code flatMap(flatMap(m, f), g) == flatMap(m, a -> flatMap(f(a), g))}</li>
 * </ul>
 *
 * <p>단락(short-circuit) 상태의 값에 대해 {@code flatMap}은 함수를 호출하지 않고
 * 그 값을 그대로 돌려줘야 합니다.</p>
 *
 * @param <W> 컨테이너 계열 witness
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public interface Monad<W> {

    /**
     * 값을 성공 상태의 컨테이너로 감쌈.
     *
     * @param value 감쌀 값
     * @param <A> 값 타입
     * @return 성공 상태 컨테이너
     */
    <A> Kind<W, A> unit(A value);

    /**
     * 컨테이너의 값을 다음 계산으로 연결.
     *
     * @param m 원본 컨테이너
     * @param f 다음 계산
     * @param <A> 원본 값 타입
     * @param <B> 결과 값 타입
     * @return 연결된 결과 (단락 상태면 원본 그대로)
     */
    <A, B> Kind<W, B> flatMap(Kind<W, A> m, Function<? super A, ? extends Kind<W, B>> f);

    /**
     * {@link #flatMap}과 {@link #unit}으로 유도한 map.
     *
     * @param m 원본 컨테이너
     * @param f 변환 함수
     * @param <A> 원본 값 타입
     * @param <B> 결과 값 타입
     * @return 변환된 컨테이너
     */
    default <A, B> Kind<W, B> map(Kind<W, A> m, Function<? super A, ? extends B> f) {
        return flatMap(m, a -> unit(f.apply(a)));
    }
}
