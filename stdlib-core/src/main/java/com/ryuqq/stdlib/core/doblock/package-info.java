/**
 * Do-block interpreter.
 *
 * <p>A computation that chains several fallible or optional steps is written as a
 * {@link com.ryuqq.stdlib.core.doblock.Program} (bind / early return / last expression) and driven by
 * {@link com.ryuqq.stdlib.core.doblock.DoBlock} over any {@link com.ryuqq.stdlib.core.monad.Monad}.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Explicit early return:</strong> a tagged program step, not an exception</li>
 *   <li><strong>Short-circuit:</strong> continuations after Nothing / Left are never invoked</li>
 *   <li><strong>Fresh runs:</strong> every invocation builds a new program</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Stdlib Team
 */
package com.ryuqq.stdlib.core.doblock;
