package com.ryuqq.relay.core.fault;

import com.ryuqq.relay.core.model.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 예외 이름과 타입을 연결하는 레지스트리.
 *
 * <p><strong>조회 규칙:</strong></p>
 * <ul>
 *   <li>내장 이름: 실제 Java 예외를 만드는 공유 핸들</li>
 *   <li>그 외 유효한 이름: 처음 조회할 때 만들어 캐시하는 {@link RemoteFault} 핸들
 *       (반복 조회 시 같은 핸들 반환)</li>
 * </ul>
 *
 * <p>형식이 올바른 이름이면 조회는 실패하지 않으며, 모르는 이름은 필요할 때 생성합니다.
 * 스레드 안전합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ExceptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExceptionRegistry.class);

    private static final Map<String, FaultType> BUILTINS = builtins();

    private final Map<String, FaultType> dynamic = new ConcurrentHashMap<>();

    /**
     * {@code name}에 해당하는 예외 핸들 조회.
     *
     * @param name 예외 이름
     * @return 이 레지스트리 안에서 항상 같은 핸들
     * @throws DescriptionException 이름 형식이 잘못된 경우
     */
    public FaultType get(String name) {
        FaultType builtin = BUILTINS.get(name);
        if (builtin != null) {
            return builtin;
        }
        Names.validate(name);
        return dynamic.computeIfAbsent(name, key -> {
            log.debug("Creating remote fault type '{}'", key);
            return FaultType.remote(key);
        });
    }

    public boolean isBuiltin(String name) {
        return BUILTINS.containsKey(name);
    }

    /**
     * 지금까지 생성된 핸들 이름 (내장 제외).
     */
    public List<String> dynamicNames() {
        return dynamic.keySet().stream().sorted().toList();
    }

    public static List<String> builtinNames() {
        return List.copyOf(BUILTINS.keySet());
    }

    private static Map<String, FaultType> builtins() {
        Map<String, FaultType> map = new LinkedHashMap<>();
        builtin(map, IllegalArgumentException.class, IllegalArgumentException::new);
        builtin(map, IllegalStateException.class, IllegalStateException::new);
        builtin(map, UnsupportedOperationException.class, UnsupportedOperationException::new);
        builtin(map, ArithmeticException.class, ArithmeticException::new);
        builtin(map, NullPointerException.class, NullPointerException::new);
        builtin(map, IndexOutOfBoundsException.class, IndexOutOfBoundsException::new);
        builtin(map, NumberFormatException.class, NumberFormatException::new);
        map.put(RequestException.NAME,
            FaultType.builtin(RequestException.NAME, RequestException.class, RequestException::new));
        return Collections.unmodifiableMap(map);
    }

    private static <X extends RuntimeException> void builtin(Map<String, FaultType> map,
                                                             Class<X> type,
                                                             Function<String, X> constructor) {
        String name = type.getSimpleName();
        map.put(name, FaultType.builtin(name, type, args -> constructor.apply(message(args))));
    }

    private static String message(List<Object> args) {
        if (args.isEmpty()) {
            return null;
        }
        if (args.size() == 1) {
            return String.valueOf(args.get(0));
        }
        return args.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
