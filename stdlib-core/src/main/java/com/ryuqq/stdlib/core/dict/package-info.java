/**
 * Pure combinators over associative mappings: filtering, validated lookup, shallow and deep merge,
 * and delimiter-based key unflattening.
 *
 * @since 1.0.0
 * @author Stdlib Team
 */
package com.ryuqq.stdlib.core.dict;
