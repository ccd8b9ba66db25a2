package com.ryuqq.stdlib.core.either;

import com.ryuqq.stdlib.core.monad.Kind;
import com.ryuqq.stdlib.core.monad.Monad;

import java.util.function.Function;

/**
 * Either 계열의 Monad 구현.
 *
 * <p>상태가 없으므로 모든 Left 타입에 하나의 인스턴스를 공유합니다.</p>
 *
 * @param <L> 실패 값 타입
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
final class EitherMonad<L> implements Monad<Either.Mu<L>> {

    private static final EitherMonad<?> INSTANCE = new EitherMonad<>();

    private EitherMonad() {
    }

    @SuppressWarnings("unchecked")
    static <L> EitherMonad<L> instance() {
        return (EitherMonad<L>) INSTANCE;
    }

    @Override
    public <A> Kind<Either.Mu<L>, A> unit(A value) {
        return Either.right(value);
    }

    @Override
    public <A, B> Kind<Either.Mu<L>, B> flatMap(Kind<Either.Mu<L>, A> m,
                                                Function<? super A, ? extends Kind<Either.Mu<L>, B>> f) {
        return Either.narrow(m).flatMap(a -> Either.narrow(f.apply(a)));
    }
}
