package com.ryuqq.relay.core.fault;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 예외의 와이어 형식: {@code {"__exception__": {"cls": name, "args": [...]}}}.
 *
 * @param cls 예외 이름
 * @param args 위치 인자 (null 포함 가능)
 * @author Relay Team
 * @since 1.0.0
 */
public record WireFault(String cls, List<Object> args) {

    public static final String RESERVED_KEY = "__exception__";
    public static final String CLS = "cls";
    public static final String ARGS = "args";

    public WireFault {
        if (cls == null || cls.isBlank()) {
            throw new IllegalArgumentException("cls cannot be null or blank");
        }
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static WireFault of(Throwable fault) {
        if (fault == null) {
            throw new IllegalArgumentException("fault cannot be null");
        }
        return new WireFault(Faults.nameOf(fault), Faults.argsOf(fault));
    }

    /**
     * 화이트리스트 밖 예외 대신 보내는 범용 예외.
     */
    public static WireFault redacted() {
        return new WireFault(RequestException.NAME, List.of(RequestException.INTERNAL_ERROR));
    }

    /**
     * {@link #RESERVED_KEY} 아래에 이 예외를 담은 응답 payload.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put(CLS, cls);
        body.put(ARGS, new ArrayList<>(args));
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(RESERVED_KEY, body);
        return payload;
    }

    /**
     * {@link #RESERVED_KEY} 아래 값 파싱.
     *
     * @param value 디코딩된 값
     * @return 파싱된 예외
     * @throws IllegalArgumentException 기대한 형태가 아닌 경우
     */
    public static WireFault parse(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Malformed fault payload: expected an object but got " + value);
        }
        if (!(map.get(CLS) instanceof String cls)) {
            throw new IllegalArgumentException("Malformed fault payload: missing '" + CLS + "'");
        }
        Object args = map.get(ARGS);
        if (args == null) {
            return new WireFault(cls, List.of());
        }
        if (!(args instanceof List<?> list)) {
            throw new IllegalArgumentException("Malformed fault payload: '" + ARGS + "' is not a list");
        }
        return new WireFault(cls, new ArrayList<>(list));
    }
}
