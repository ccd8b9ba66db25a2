package com.ryuqq.stdlib.core.either;

/**
 * 성공 갈래.
 *
 * @param value 성공 값 (null 허용)
 * @param <L> 실패 값 타입 (표식용)
 * @param <R> 성공 값 타입
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public record Right<L, R>(R value) implements Either<L, R> {

    @Override
    public String toString() {
        return "Right{" + value + '}';
    }
}
