/**
 * Optional value container.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stdlib.core.maybe.Maybe} - Sealed interface (permits Some, Nothing)</li>
 *   <li>{@link com.ryuqq.stdlib.core.maybe.Some} - A present, non-null value</li>
 *   <li>{@link com.ryuqq.stdlib.core.maybe.Nothing} - Absence (no payload)</li>
 * </ul>
 *
 * <p>Absence is a value, never a failure: no operation of this package throws because a value is missing.</p>
 *
 * @since 1.0.0
 * @author Stdlib Team
 */
package com.ryuqq.stdlib.core.maybe;
