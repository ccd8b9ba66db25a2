package com.ryuqq.stdlib.core.either;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Either.sequence / Either.traverse 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>입력 순서 유지</li>
 *   <li>첫 번째 Left 반환 (마지막이 아님)</li>
 *   <li>첫 Left 이후 원소는 평가되지 않음</li>
 * </ul>
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
class EitherSequenceTest {

    private static Either<String, Integer> parse(String text) {
        return text.matches("\\d+") ? Either.right(Integer.parseInt(text)) : Either.left(text);
    }

    @Test
    void sequence_Empty_ReturnsRightOfEmptyList() {
        // When
        Either<String, List<Integer>> result = Either.sequence(List.<Either<String, Integer>>of());

        // Then
        assertThat(result).isEqualTo(Either.right(List.of()));
    }

    @Test
    void sequence_AllRight_ReturnsValuesInOrder() {
        // Given
        List<Either<String, Integer>> input = List.of(Either.right(1), Either.right(2));

        // When
        Either<String, List<Integer>> result = Either.sequence(input);

        // Then
        assertThat(result).isEqualTo(Either.right(List.of(1, 2)));
    }

    @Test
    void sequence_LeftInMiddle_ReturnsThatLeft() {
        // Given
        List<Either<String, Integer>> input = List.of(Either.right(1), Either.left("x"), Either.right(2));

        // When
        Either<String, List<Integer>> result = Either.sequence(input);

        // Then
        assertThat(result).isEqualTo(Either.left("x"));
    }

    @Test
    void sequence_SeveralLefts_ReturnsFirstNotLast() {
        // Given
        List<Either<String, Integer>> leadingLeft = List.of(Either.left("x"), Either.right(1));
        List<Either<String, Integer>> twoLefts = List.of(Either.right(0), Either.left("first"), Either.left("second"));

        // When
        Either<String, List<Integer>> first = Either.sequence(leadingLeft);
        Either<String, List<Integer>> many = Either.sequence(twoLefts);

        // Then
        assertThat(first).isEqualTo(Either.left("x"));
        assertThat(many).isEqualTo(Either.left("first"));
    }

    @Test
    void sequence_LazyIterable_StopsPullingAfterFirstLeft() {
        // Given
        List<String> evaluated = new ArrayList<>();
        Iterable<Either<String, Integer>> lazy = () -> Stream.of("1", "x", "3", "y")
            .map(text -> {
                evaluated.add(text);
                return parse(text);
            })
            .iterator();

        // When
        Either<String, List<Integer>> result = Either.sequence(lazy);

        // Then
        assertThat(result).isEqualTo(Either.left("x"));
        assertThat(evaluated).containsExactly("1", "x");
    }

    @Test
    void traverse_NeverAppliesFunctionAfterFirstLeft() {
        // Given
        List<String> applied = new ArrayList<>();

        // When
        Either<String, List<Integer>> result = Either.traverse(List.of("4", "five", "6"), text -> {
            applied.add(text);
            return parse(text);
        });

        // Then
        assertThat(result).isEqualTo(Either.left("five"));
        assertThat(applied).containsExactly("4", "five");
    }

    @Test
    void traverse_AllRight_ReturnsUnmodifiableList() {
        // When
        Either<String, List<Integer>> result = Either.traverse(List.of("4", "5"), EitherSequenceTest::parse);

        // Then
        List<Integer> values = result.getOrElse(List.of());
        assertThat(values).containsExactly(4, 5);
        assertThatThrownBy(() -> values.add(6)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void sequence_NullInput_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> Either.sequence(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("items cannot be null");
    }
}
