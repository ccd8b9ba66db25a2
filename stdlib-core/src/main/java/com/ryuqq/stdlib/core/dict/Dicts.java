package com.ryuqq.stdlib.core.dict;

import com.ryuqq.stdlib.core.either.Either;
import com.ryuqq.stdlib.core.maybe.Maybe;

import java.util.AbstractMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * 연관 매핑(Map) 조합 함수.
 *
 * <p>모든 연산은 순수 함수입니다. 입력 Map은 변경하지 않으며, 삽입 순서를
 * 유지하는 새 Map을 반환합니다.</p>
 *
 * <p><strong>중첩 Map:</strong> {@link #deepMerge}와 {@link #unflattenKeys}는 값이 다시
 * Map일 수 있는 트리 구조를 다룹니다. 입력은 유한한 깊이여야 하며 자기 자신을
 * 참조하는 Map은 지원하지 않습니다. 재귀 깊이는 중첩 깊이와 같습니다.</p>
 *
 * @author Stdlib Team
 * @since 1.0.0
 */
public final class Dicts {

    private static final String DEFAULT_SEPARATOR = ".";

    // Utility class - prevent instantiation
    private Dicts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 키와 값에 대한 조건으로 필터링.
     *
     * @param predicate 조건 (key, value)
     * @param map 원본 Map
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return 조건을 만족하는 항목만 담은 새 Map
     */
    public static <K, V> Map<K, V> filterByPredicate(BiPredicate<? super K, ? super V> predicate, Map<K, V> map) {
        requireNonNull(predicate, "predicate");
        requireNonNull(map, "map");

        Map<K, V> result = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (predicate.test(key, value)) {
                result.put(key, value);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /**
     * 키 공간에 속한 항목만 남김.
     *
     * @param keys 키 공간
     * @param map 원본 Map
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return keys에 포함된 키의 항목만 담은 새 Map
     */
    public static <K, V> Map<K, V> filterByKeySet(Set<? extends K> keys, Map<K, V> map) {
        requireNonNull(keys, "keys");
        return filterByPredicate((key, value) -> keys.contains(key), map);
    }

    /**
     * 키에 연결된 값 조회.
     *
     * <p>키가 없거나 값이 null이면 Nothing입니다.</p>
     *
     * @param key 키
     * @param map 원본 Map
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return 조회 결과
     */
    public static <K, V> Maybe<V> lookup(K key, Map<K, V> map) {
        requireNonNull(map, "map");
        return Maybe.of(map.get(key));
    }

    /**
     * 키 공간의 모든 키에 대한 값 조회.
     *
     * <p>keys의 순회 순서대로 조회하며, 첫 번째로 없는 키에서 멈춥니다.</p>
     *
     * @param keys 키 공간 (중복 없는 순회 순서를 가져야 함)
     * @param map 원본 Map
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return 첫 번째 누락 키의 Left, 또는 keys로 제한된 Map의 Right
     */
    public static <K, V> Either<K, Map<K, V>> lookupAllOrFail(Set<? extends K> keys, Map<K, V> map) {
        requireNonNull(keys, "keys");
        requireNonNull(map, "map");

        return Either.<K, K, Map.Entry<K, V>>traverse(keys, key -> lookup(key, map)
                .<Either<K, Map.Entry<K, V>>>mapOr(
                    Either.left(key),
                    value -> Either.right(new AbstractMap.SimpleImmutableEntry<>(key, value))))
            .map(Dicts::toMap);
    }

    /**
     * 키 삭제.
     *
     * @param key 삭제할 키
     * @param map 원본 Map
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return key가 없는 새 Map (없던 키면 같은 내용의 복사본)
     */
    public static <K, V> Map<K, V> remove(K key, Map<K, V> map) {
        requireNonNull(map, "map");
        Map<K, V> result = new LinkedHashMap<>(map);
        result.remove(key);
        return Collections.unmodifiableMap(result);
    }

    /**
     * 키/값 삽입 (기존 값은 교체).
     *
     * @param key 키
     * @param value 값
     * @param map 원본 Map
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return 항목이 반영된 새 Map
     */
    public static <K, V> Map<K, V> insertOrReplace(K key, V value, Map<K, V> map) {
        requireNonNull(map, "map");
        Map<K, V> result = new LinkedHashMap<>(map);
        result.put(key, value);
        return Collections.unmodifiableMap(result);
    }

    /**
     * 커리된 한 단계 병합.
     *
     * <p>두 번째 Map의 항목이 같은 키의 첫 번째 Map 항목을 덮어씁니다.</p>
     *
     * @param first 첫 번째 Map
     * @param <K> 키 타입
     * @param <V> 값 타입
     * @return 두 번째 Map을 받아 병합 결과를 반환하는 함수
     */
    public static <K, V> UnaryOperator<Map<K, V>> shallowMerge(Map<K, V> first) {
        requireNonNull(first, "first");
        return second -> {
            requireNonNull(second, "second");
            Map<K, V> result = new LinkedHashMap<>(first);
            result.putAll(second);
            return Collections.unmodifiableMap(result);
        };
    }

    /**
     * 재귀 병합.
     *
     * <p>양쪽 모두에 있고 두 값이 모두 Map인 키는 재귀적으로 병합합니다.
     * 그 외 충돌은 second의 값이 우선합니다. 문자열이나 숫자처럼 다른 값은
     * 합치지 않고 덮어씁니다.</p>
     *
     * @param first 첫 번째 Map
     * @param second 두 번째 Map
     * @param <K> 키 타입
     * @return 병합된 새 Map
     */
    public static <K> Map<K, Object> deepMerge(Map<K, ?> first, Map<K, ?> second) {
        requireNonNull(first, "first");
        requireNonNull(second, "second");

        Map<K, Object> result = new LinkedHashMap<>(first);
        second.forEach((key, value) -> {
            Object existing = result.get(key);
            if (existing instanceof Map<?, ?> left && value instanceof Map<?, ?> right) {
                result.put(key, deepMerge(nested(left), nested(right)));
            } else {
                result.put(key, value);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    /**
     * 구분자를 포함한 키를 중첩 Map으로 펼침.
     *
     * <p>각 키를 구분자로 나눈 경로를 따라 단일 항목 중첩 Map을 만들고,
     * 입력 순서대로 빈 Map에서 시작해 {@link #deepMerge}로 접습니다.
     * 구분자가 없는 키는 최상위 값이 됩니다. 같은 경로에서 값과 하위 Map이
     * 충돌하면 나중에 처리된 항목이 이깁니다 (둘 다 Map인 경우는 병합).</p>
     *
     * <pre>
     * unflattenKeys({"a.b": 1, "a.c": 2, "x": 3}, ".") == {"a": {"b": 1, "c": 2}, "x": 3}
     * </pre>
     *
     * @param map 평평한 Map
     * @param separator 경로 구분자
     * @return 중첩 Map
     * @throws IllegalArgumentException separator가 null이거나 빈 문자열인 경우
     */
    public static Map<String, Object> unflattenKeys(Map<String, ?> map, String separator) {
        requireNonNull(map, "map");
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("separator cannot be null or empty");
        }

        Pattern splitter = Pattern.compile(Pattern.quote(separator));
        Map<String, Object> result = Collections.emptyMap();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            List<String> path = List.of(splitter.split(entry.getKey(), -1));
            result = deepMerge(result, singletonPath(path, entry.getValue()));
        }
        return result;
    }

    /**
     * {@code "."} 구분자로 키를 펼침.
     *
     * @param map 평평한 Map
     * @return 중첩 Map
     * @see #unflattenKeys(Map, String)
     */
    public static Map<String, Object> unflattenKeys(Map<String, ?> map) {
        return unflattenKeys(map, DEFAULT_SEPARATOR);
    }

    @SuppressWarnings("unchecked")
    private static Map<Object, Object> nested(Map<?, ?> map) {
        return (Map<Object, Object>) map;
    }

    private static Map<String, Object> singletonPath(List<String> path, Object value) {
        Object current = value;
        for (int i = path.size() - 1; i > 0; i--) {
            current = Collections.singletonMap(path.get(i), current);
        }
        return Collections.singletonMap(path.get(0), current);
    }

    private static <K, V> Map<K, V> toMap(List<Map.Entry<K, V>> entries) {
        Map<K, V> result = new LinkedHashMap<>();
        for (Map.Entry<K, V> entry : entries) {
            result.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(result);
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
