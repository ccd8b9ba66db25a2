package com.ryuqq.stdlib.core.maybe;

/**
 * 값이 있는 Maybe.
 *
 * @param value 값 (null 불가)
 * @param <T> 값 타입
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public record Some<T>(T value) implements Maybe<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Some {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null (use Maybe.of for nullable values)");
        }
    }

    @Override
    public String toString() {
        return "Some{" + value + '}';
    }
}
