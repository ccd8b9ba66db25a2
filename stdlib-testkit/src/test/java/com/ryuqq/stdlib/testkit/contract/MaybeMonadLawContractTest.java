package com.ryuqq.stdlib.testkit.contract;

import com.ryuqq.stdlib.core.maybe.Maybe;
import com.ryuqq.stdlib.core.monad.Kind;
import com.ryuqq.stdlib.core.monad.Monad;

/**
 * Maybe Monad 계약 테스트.
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
class MaybeMonadLawContractTest extends AbstractMonadLawContractTest<Maybe.Mu> {

    @Override
    protected Monad<Maybe.Mu> monad() {
        return Maybe.monad();
    }

    @Override
    protected Kind<Maybe.Mu, Integer> success(int value) {
        return Maybe.some(value);
    }

    @Override
    protected Kind<Maybe.Mu, Integer> shortCircuit() {
        return Maybe.nothing();
    }
}
