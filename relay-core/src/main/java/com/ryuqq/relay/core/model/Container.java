package com.ryuqq.relay.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 요청/응답 필드를 담는 컨테이너.
 *
 * <p>삽입 순서를 유지하는 Map 하나를 감쌉니다. 없는 키를 읽으면 {@code null}을
 * 반환하고 키를 추가하지 않습니다. 쓰기는 항상 성공합니다.</p>
 *
 * <pre>
 * Container request = new Container();
 * request.set("text", "hi");
 * String text = request.get("text", String.class);
 * Object missing = request.get("nope");   // null, Map 변경 없음
 * </pre>
 *
 * <p>하나의 Processor가 소유하며 스레드 안전하지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class Container {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    public Container() {
    }

    public Container(Map<String, ?> initial) {
        putAll(initial);
    }

    /**
     * {@code key}에 저장된 값 조회.
     *
     * @param key 필드 이름
     * @return 저장된 값, 없으면 null
     */
    public Object get(String key) {
        return fields.get(key);
    }

    /**
     * 타입 지정 조회.
     *
     * @param key 필드 이름
     * @param type 기대 타입
     * @param <T> 값 타입
     * @return {@code type}으로 캐스팅된 값, 없으면 null
     * @throws ClassCastException 저장된 값이 {@code type}이 아닌 경우
     */
    public <T> T get(String key, Class<T> type) {
        return type.cast(fields.get(key));
    }

    /**
     * 값 저장 (기존 값은 덮어씀).
     *
     * @param key 필드 이름
     * @param value 값 (null 허용)
     * @return 이 컨테이너
     */
    public Container set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        fields.put(key, value);
        return this;
    }

    public Container putAll(Map<String, ?> values) {
        if (values != null) {
            values.forEach(this::set);
        }
        return this;
    }

    public boolean containsKey(String key) {
        return fields.containsKey(key);
    }

    public Object remove(String key) {
        return fields.remove(key);
    }

    public void clear() {
        fields.clear();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    /**
     * 삽입 순서를 유지하는 읽기 전용 뷰.
     *
     * @return 수정 불가능한 라이브 뷰
     */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + fields;
    }
}
