package com.ryuqq.relay.core.model;

import com.ryuqq.relay.core.fault.DescriptionException;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 선언형 기술(description)에서 {@link ApiConfig} 생성.
 *
 * <p><strong>기술 형식:</strong></p>
 * <pre>
 * {
 *   "name": "echo",
 *   "version": "1",
 *   "endpoint": {"scheme": "http", "host": "localhost", "port": 8080, "pattern": "/api/{version}/{operation}"},
 *   "timeout": 2,
 *   "debug": false,
 *   "exceptions": ["NotFound"],
 *   "operations": [
 *     {"name": "upper", "input": ["text"], "output": ["result"]},
 *     "ping"
 *   ]
 * }
 * </pre>
 *
 * <p>입력 값은 {@link #defaults()}의 새 깊은 복사본 위에 병합되며, {@code endpoint}는
 * 키 단위로 병합됩니다. 어느 단계든 모르는 키는 metadata로 보존합니다.
 * {@code timeout}은 초 단위이며 소수도 허용합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ApiDescription {

    public static final String NAME = "name";
    public static final String VERSION = "version";
    public static final String ENDPOINT = "endpoint";
    public static final String TIMEOUT = "timeout";
    public static final String DEBUG = "debug";
    public static final String EXCEPTIONS = "exceptions";
    public static final String OPERATIONS = "operations";

    private static final Set<String> API_KEYS =
        Set.of(NAME, VERSION, ENDPOINT, TIMEOUT, DEBUG, EXCEPTIONS, OPERATIONS);
    private static final Set<String> ENDPOINT_KEYS = Set.of("scheme", "host", "port", "pattern");
    private static final Set<String> OPERATION_KEYS = Set.of("name", "input", "output");

    private ApiDescription() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 기술 기본값. 호출할 때마다 독립된 새 깊은 복사본을 반환합니다.
     *
     * @return 수정 가능한 기본 기술
     */
    public static Map<String, Object> defaults() {
        Map<String, Object> endpoint = new LinkedHashMap<>();
        endpoint.put("scheme", "http");
        endpoint.put("host", "localhost");
        endpoint.put("port", 8080);
        endpoint.put("pattern", "/api/{version}/{operation}");

        Map<String, Object> api = new LinkedHashMap<>();
        api.put(VERSION, "0");
        api.put(TIMEOUT, 2);
        api.put(DEBUG, false);
        api.put(ENDPOINT, endpoint);
        api.put(EXCEPTIONS, new ArrayList<>());
        api.put(OPERATIONS, new ArrayList<>());
        return api;
    }

    /**
     * 기본값 위에 {@code description}을 병합해 설정 생성.
     *
     * <p>인자는 먼저 깊은 복사되므로 이후 변경은 결과에 영향을 주지 않습니다.</p>
     *
     * @param description 파싱된 기술 객체
     * @return 검증된 설정
     * @throws DescriptionException 기술의 일부라도 형식이 잘못된 경우
     */
    public static ApiConfig fromDescription(Map<String, ?> description) {
        if (description == null) {
            throw new DescriptionException("description cannot be null");
        }
        Map<String, Object> api = merge(defaults(), asMap(deepCopy(description), "description"));

        Map<String, Object> metadata = new LinkedHashMap<>();
        api.forEach((key, value) -> {
            if (!API_KEYS.contains(key)) {
                metadata.put(key, value);
            }
        });

        return new ApiConfig(
            requireString(api.get(NAME), NAME),
            version(api.get(VERSION)),
            endpoint(asMap(api.get(ENDPOINT), ENDPOINT)),
            timeout(api.get(TIMEOUT)),
            bool(api.get(DEBUG), DEBUG),
            stringSet(api.get(EXCEPTIONS), EXCEPTIONS),
            operations(api.get(OPERATIONS)),
            metadata
        );
    }

    /**
     * 오퍼레이션 항목 하나 파싱 (이름 문자열 또는 객체).
     *
     * @param entry 기술 항목
     * @return 디스크립터
     */
    public static OperationDescriptor operation(Object entry) {
        if (entry instanceof String name) {
            return OperationDescriptor.named(name);
        }
        Map<String, Object> operation = asMap(entry, "operation");
        Map<String, Object> metadata = new LinkedHashMap<>();
        operation.forEach((key, value) -> {
            if (!OPERATION_KEYS.contains(key)) {
                metadata.put(key, value);
            }
        });
        String name = requireString(operation.get("name"), "operation name");
        return new OperationDescriptor(
            name,
            stringList(operation.get("input"), name + ".input"),
            stringList(operation.get("output"), name + ".output"),
            metadata
        );
    }

    private static Endpoint endpoint(Map<String, Object> endpoint) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        endpoint.forEach((key, value) -> {
            if (!ENDPOINT_KEYS.contains(key)) {
                metadata.put(key, value);
            }
        });
        return new Endpoint(
            optionalString(endpoint.get("scheme"), "endpoint.scheme"),
            optionalString(endpoint.get("host"), "endpoint.host"),
            port(endpoint.get("port")),
            optionalString(endpoint.get("pattern"), "endpoint.pattern"),
            metadata
        );
    }

    private static List<OperationDescriptor> operations(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> entries)) {
            throw new DescriptionException("'operations' must be a list");
        }
        List<OperationDescriptor> operations = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            operations.add(operation(entry));
        }
        return operations;
    }

    private static String version(Object value) {
        if (value instanceof String || value instanceof Number) {
            return String.valueOf(value);
        }
        throw new DescriptionException("'version' must be a string or a number (current: " + value + ")");
    }

    private static Duration timeout(Object value) {
        if (!(value instanceof Number seconds)) {
            throw new DescriptionException("'timeout' must be a number of seconds");
        }
        double millis = seconds.doubleValue() * 1000d;
        if (!(millis > 0)) {
            throw new DescriptionException("'timeout' must be positive (current: " + value + ")");
        }
        return Duration.ofMillis(Math.max(1L, Math.round(millis)));
    }

    private static Integer port(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return wholePort(number);
        }
        if (value instanceof String text) {
            try {
                return Integer.valueOf(text.trim());
            } catch (NumberFormatException e) {
                throw new DescriptionException("Invalid endpoint port: '" + text + "'", e);
            }
        }
        throw new DescriptionException("Invalid endpoint port: " + value);
    }

    private static Integer wholePort(Number number) {
        long whole;
        if (number instanceof Integer || number instanceof Long
            || number instanceof Short || number instanceof Byte) {
            whole = number.longValue();
        } else if (number instanceof BigInteger big) {
            if (big.bitLength() >= Long.SIZE) {
                throw new DescriptionException("Invalid endpoint port: " + number);
            }
            whole = big.longValue();
        } else {
            double real = number.doubleValue();
            if (Double.isNaN(real) || Double.isInfinite(real) || real != Math.rint(real)) {
                throw new DescriptionException("Endpoint port must be a whole number: " + number);
            }
            whole = (long) real;
        }
        try {
            return Math.toIntExact(whole);
        } catch (ArithmeticException e) {
            throw new DescriptionException("Invalid endpoint port: " + number, e);
        }
    }

    private static boolean bool(Object value, String key) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        throw new DescriptionException("'" + key + "' must be a boolean");
    }

    private static String requireString(Object value, String key) {
        if (value == null) {
            throw new DescriptionException("Missing required '" + key + "'");
        }
        return optionalString(value, key);
    }

    private static String optionalString(Object value, String key) {
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new DescriptionException("'" + key + "' must be a string");
    }

    private static List<String> stringList(Object value, String key) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new DescriptionException("'" + key + "' must be a list of names");
        }
        List<String> names = new ArrayList<>(items.size());
        for (Object item : items) {
            names.add(requireString(item, key));
        }
        return names;
    }

    private static Set<String> stringSet(Object value, String key) {
        return new LinkedHashSet<>(stringList(value, key));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new DescriptionException("'" + key + "' must be an object");
        }
        for (Object k : map.keySet()) {
            if (!(k instanceof String)) {
                throw new DescriptionException("'" + key + "' has a non-string key: " + k);
            }
        }
        return (Map<String, Object>) map;
    }

    private static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overrides) {
        overrides.forEach((key, value) -> {
            Object current = base.get(key);
            if (ENDPOINT.equals(key) && current instanceof Map<?, ?> && value instanceof Map<?, ?>) {
                Map<String, Object> endpoint = asMap(current, ENDPOINT);
                endpoint.putAll(asMap(value, ENDPOINT));
            } else {
                base.put(key, value);
            }
        });
        return base;
    }

    /**
     * metadata의 읽기 전용 깊은 복사본.
     *
     * <p>중첩된 Map과 List도 수정 불가로 만들며, null 값은 그대로 유지합니다.</p>
     *
     * @param metadata 고정할 metadata (null 허용)
     * @return 수정 불가능한 복사본
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> freeze(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return (Map<String, Object>) frozen(metadata);
    }

    private static Object frozen(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, frozen(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(frozen(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Map과 List를 재귀적으로 복사 (입력과 가변 구조를 공유하지 않음).
     * 리프 값은 그대로 둡니다.
     *
     * @param value 복사할 값
     * @return 깊은 복사본
     */
    public static Object deepCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, deepCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepCopy(item));
            }
            return copy;
        }
        return value;
    }
}
