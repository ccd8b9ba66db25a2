package com.ryuqq.stdlib.core.monad;

/**
 * 컨테이너 계열 {@code W}에 속하며 {@code A} 값을 담는 타입의 표식.
 *
 * <p>Java에는 고차 타입(higher-kinded type)이 없으므로, {@code Maybe<A>}나
 * {@code Either<L, A>}를 하나의 {@link Monad} 구현으로 다루기 위해
 * 계열을 나타내는 witness 타입 {@code W}를 사용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>{@code Maybe<A>} → {@code Kind<Maybe.Mu, A>}</li>
 *   <li>{@code Either<L, A>} → {@code Kind<Either.Mu<L>, A>}</li>
 * </ul>
 *
 * @param <W> 컨테이너 계열 witness
 * @param <A> 담긴 값의 타입
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public interface Kind<W, A> {
}
