package com.ryuqq.relay.core.model;

import com.ryuqq.relay.core.fault.DescriptionException;

import java.util.Map;

/**
 * API가 서비스되는 위치.
 *
 * <p>서비스는 {@code pattern}만, 클라이언트는 네 항목 모두를 필요로 하므로 생성 시점에는
 * 전부 선택 사항입니다. 누락된 항목은 클라이언트 포맷이나 서비스 매처를 만들 때
 * 보고됩니다 ({@link ApiConfig} 참고).</p>
 *
 * <p>{@code pattern}이 있으면 {@value #OPERATION_PLACEHOLDER}를 정확히 한 번 포함해야 하며,
 * API 버전으로 치환되는 {@value #VERSION_PLACEHOLDER}를 포함할 수 있습니다.</p>
 *
 * @param scheme URI 스킴 (예: {@code http})
 * @param host 호스트 이름
 * @param port TCP 포트
 * @param pattern 경로 패턴 (예: {@code /api/{version}/{operation}})
 * @param metadata 인식하지 못한 엔드포인트 키 (읽기 전용으로 보존)
 *
 * @author Relay Team
 * @since 1.0.0
 */
public record Endpoint(
    String scheme,
    String host,
    Integer port,
    String pattern,
    Map<String, Object> metadata
) {

    public static final String OPERATION_PLACEHOLDER = "{operation}";
    public static final String VERSION_PLACEHOLDER = "{version}";

    public Endpoint {
        if (pattern != null && occurrences(pattern, OPERATION_PLACEHOLDER) != 1) {
            throw new DescriptionException(
                "Endpoint pattern must contain exactly one " + OPERATION_PLACEHOLDER + " placeholder: '" + pattern + "'");
        }
        if (port != null && (port < 0 || port > 65535)) {
            throw new DescriptionException("Endpoint port out of range: " + port);
        }
        metadata = ApiDescription.freeze(metadata);
    }

    public static Endpoint of(String scheme, String host, Integer port, String pattern) {
        return new Endpoint(scheme, host, port, pattern, Map.of());
    }

    private static int occurrences(String text, String token) {
        int count = 0;
        int from = text.indexOf(token);
        while (from >= 0) {
            count++;
            from = text.indexOf(token, from + token.length());
        }
        return count;
    }
}
