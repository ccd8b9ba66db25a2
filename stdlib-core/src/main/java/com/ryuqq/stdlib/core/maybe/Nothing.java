package com.ryuqq.stdlib.core.maybe;

/**
 * 값이 없는 Maybe.
 *
 * <p>payload가 없으므로 모든 Nothing은 서로 같습니다.</p>
 *
 * @param <T> 값 타입 (표식용)
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public record Nothing<T>() implements Maybe<T> {

    private static final Nothing<?> INSTANCE = new Nothing<>();

    @SuppressWarnings("unchecked")
    static <T> Nothing<T> instance() {
        return (Nothing<T>) INSTANCE;
    }

    @Override
    public String toString() {
        return "Nothing";
    }
}
