/**
 * Reusable contract tests for containers that plug into the do-block interpreter.
 *
 * @since 1.0.0
 * @author Stdlib Team
 */
package com.ryuqq.stdlib.testkit.contract;
