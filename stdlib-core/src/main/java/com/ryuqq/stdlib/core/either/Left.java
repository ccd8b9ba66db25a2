package com.ryuqq.stdlib.core.either;

/**
 * 실패 갈래.
 *
 * @param value 실패 값 (null 허용)
 * @param <L> 실패 값 타입
 * @param <R> 성공 값 타입 (표식용)
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public record Left<L, R>(L value) implements Either<L, R> {

    @Override
    public String toString() {
        return "Left{" + value + '}';
    }
}
