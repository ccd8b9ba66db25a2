/**
 * Container capability package.
 *
 * <p>Java has no higher-kinded types, so containers are tagged with a witness type through
 * {@link com.ryuqq.stdlib.core.monad.Kind} and share one
 * {@link com.ryuqq.stdlib.core.monad.Monad} abstraction ({@code unit}, {@code flatMap}).</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@code Maybe.monad()} - witness {@code Maybe.Mu}</li>
 *   <li>{@code Either.monad()} - witness {@code Either.Mu<L>}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Stdlib Team
 */
package com.ryuqq.stdlib.core.monad;
