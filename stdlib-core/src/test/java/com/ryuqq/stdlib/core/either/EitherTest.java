package com.ryuqq.stdlib.core.either;

import com.ryuqq.stdlib.core.maybe.Maybe;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Either 테스트.
 *
 * <p>Left 갈래가 어떤 map/flatMap 체인에서도 건드려지지 않는지 검증합니다.</p>
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class EitherTest {

    @Mock
    private Function<Integer, Integer> mapper;

    @Mock
    private Function<Integer, Either<String, Integer>> binder;

    private static Either<String, Integer> parse(String text) {
        return text.matches("-?\\d+") ? Either.right(Integer.parseInt(text)) : Either.left("not a number: " + text);
    }

    @Test
    void map_Right_AppliesMapper() {
        // When
        Either<String, Integer> result = Either.<String, Integer>right(20).map(v -> v + 1);

        // Then
        assertEquals(Either.right(21), result);
    }

    @Test
    void map_Left_ReturnsSameInstanceWithoutInvokingMapper() {
        // Given
        Either<String, Integer> left = Either.left("boom");

        // When
        Either<String, Integer> result = left.map(mapper);

        // Then
        assertSame(left, result);
        verifyNoInteractions(mapper);
    }

    @Test
    void map_Composition_EqualsComposedMap() {
        // Given
        Function<Integer, Integer> f = v -> v + 3;
        Function<Integer, String> g = v -> "#" + v;

        // When & Then
        for (Either<String, Integer> e : List.of(Either.<String, Integer>right(4), Either.<String, Integer>left("x"))) {
            assertEquals(e.map(f).map(g), e.map(g.compose(f)));
        }
    }

    @Test
    void flatMap_LeftIdentity_EqualsFunctionApplication() {
        // When & Then
        assertEquals(parse("42"), Either.<String, String>right("42").flatMap(EitherTest::parse));
        assertEquals(parse("x"), Either.<String, String>right("x").flatMap(EitherTest::parse));
    }

    @Test
    void flatMap_RightIdentity_ReturnsEqualValue() {
        // Given
        Either<String, Integer> right = Either.right(1);
        Either<String, Integer> left = Either.left("e");

        // When & Then
        assertEquals(right, right.flatMap(Either::right));
        assertEquals(left, left.flatMap(Either::right));
    }

    @Test
    void flatMap_Left_NeverInvokesMapper() {
        // Given
        Either<String, Integer> left = Either.left("first failure");

        // When
        Either<String, Integer> result = left.flatMap(binder).flatMap(binder);

        // Then
        assertSame(left, result);
        verifyNoInteractions(binder);
    }

    @Test
    void flatMap_ChainStopsAtFirstLeft() {
        // Given
        List<Integer> seen = new ArrayList<>();

        // When
        Either<String, Integer> result = parse("5")
            .flatMap(v -> {
                seen.add(v);
                return Either.<String, Integer>left("stop at " + v);
            })
            .flatMap(v -> {
                seen.add(v);
                return Either.right(v);
            });

        // Then
        assertEquals(Either.left("stop at 5"), result);
        assertThat(seen).containsExactly(5);
    }

    @Test
    void fold_CollapsesEachBranch() {
        // When & Then
        assertEquals("ok:3", parse("3").fold(e -> "err:" + e, v -> "ok:" + v));
        assertEquals("err:not a number: z", parse("z").fold(e -> "err:" + e, v -> "ok:" + v));
    }

    @Test
    void mapLeft_TransformsOnlyLeft() {
        // When & Then
        assertEquals(Either.left(5), Either.<String, Integer>left("abcde").mapLeft(String::length));
        assertEquals(Either.right(1), Either.<String, Integer>right(1).mapLeft(String::length));
    }

    @Test
    void swap_ExchangesBranches() {
        // When & Then
        assertEquals(Either.right("e"), Either.<String, Integer>left("e").swap());
        assertEquals(Either.left(1), Either.<String, Integer>right(1).swap());
    }

    @Test
    void maybeConversion_BothDirections() {
        // When & Then
        assertEquals(Maybe.some(1), Either.<String, Integer>right(1).toMaybe());
        assertTrue(Either.<String, Integer>left("e").toMaybe().isNothing());
        assertEquals(Either.right(1), Either.fromMaybe(Maybe.some(1), () -> "missing"));
        assertEquals(Either.left("missing"), Either.<String, Integer>fromMaybe(Maybe.nothing(), () -> "missing"));
    }

    @Test
    void getOrElse_ReturnsValueOrDefault() {
        // When & Then
        assertEquals(7, parse("7").getOrElse(0));
        assertEquals(0, parse("seven").getOrElse(0));
    }

    @Test
    void predicates_ReflectActiveBranch() {
        // When & Then
        assertTrue(parse("1").isRight());
        assertFalse(parse("1").isLeft());
        assertTrue(parse("a").isLeft());
        assertFalse(parse("a").isRight());
    }

    @Test
    void equalsAndHashCode_ValueBased() {
        // When & Then
        assertEquals(Either.left("x"), Either.left("x"));
        assertEquals(Either.right(1).hashCode(), Either.right(1).hashCode());
        assertNotEquals(Either.left(1), Either.right(1));
    }
}
