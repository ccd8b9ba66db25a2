/**
 * Disjoint two-branch container.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.stdlib.core.either.Either} - Sealed interface (permits Left, Right)</li>
 *   <li>{@link com.ryuqq.stdlib.core.either.Right} - Success / continuation channel</li>
 *   <li>{@link com.ryuqq.stdlib.core.either.Left} - Failure / short-circuit channel</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Either&lt;String, List&lt;Integer&gt;&gt; all = Either.sequence(List.of(Either.right(1), Either.right(2)));
 * // Right{[1, 2]}
 * </pre>
 *
 * @since 1.0.0
 * @author Stdlib Team
 */
package com.ryuqq.stdlib.core.either;
