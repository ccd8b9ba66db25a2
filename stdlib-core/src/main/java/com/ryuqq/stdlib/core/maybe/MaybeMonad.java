package com.ryuqq.stdlib.core.maybe;

import com.ryuqq.stdlib.core.monad.Kind;
import com.ryuqq.stdlib.core.monad.Monad;

import java.util.function.Function;

/**
 * Maybe 계열의 Monad 구현.
 *
 * <p>unit은 {@link Maybe#of}를 사용하므로 null은 Nothing이 됩니다.</p>
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
enum MaybeMonad implements Monad<Maybe.Mu> {

    INSTANCE;

    @Override
    public <A> Kind<Maybe.Mu, A> unit(A value) {
        return Maybe.of(value);
    }

    @Override
    public <A, B> Kind<Maybe.Mu, B> flatMap(Kind<Maybe.Mu, A> m, Function<? super A, ? extends Kind<Maybe.Mu, B>> f) {
        return Maybe.narrow(m).flatMap(a -> Maybe.narrow(f.apply(a)));
    }
}
