package com.ryuqq.relay.core.model;

import com.ryuqq.relay.core.fault.DescriptionException;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 클라이언트와 서비스가 공유하는 검증된 불변 API 설정.
 *
 * <p>{@link ApiDescription#fromDescription(Map)}에서 기본값을 병합해 생성합니다.
 * 클라이언트 포맷 문자열과 서비스 경로 매처는 처음 사용할 때 계산되어
 * 인스턴스 수명 동안 캐시됩니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 인스턴스는 불변이며, 캐시 값은 멱등하게 계산되어
 * volatile 필드로 공개됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ApiConfig {

    private static final String OPERATION_GROUP = "operation";

    private final String name;
    private final String version;
    private final Endpoint endpoint;
    private final Duration timeout;
    private final boolean debug;
    private final Set<String> exceptions;
    private final Map<String, OperationDescriptor> operations;
    private final Map<String, Object> metadata;

    private volatile String clientFormat;
    private volatile Pattern serviceMatcher;

    ApiConfig(String name,
              String version,
              Endpoint endpoint,
              Duration timeout,
              boolean debug,
              Set<String> exceptions,
              List<OperationDescriptor> operations,
              Map<String, Object> metadata) {
        if (endpoint == null) {
            throw new DescriptionException("endpoint cannot be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new DescriptionException("timeout must be positive (current: " + timeout + ")");
        }
        this.name = Names.validate(name);
        this.version = version == null ? "" : version;
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.debug = debug;

        Set<String> whitelist = new LinkedHashSet<>();
        for (String exception : exceptions) {
            whitelist.add(Names.validate(exception));
        }
        this.exceptions = Collections.unmodifiableSet(whitelist);

        Map<String, OperationDescriptor> byName = new LinkedHashMap<>();
        for (OperationDescriptor operation : operations) {
            if (byName.putIfAbsent(operation.name(), operation) != null) {
                throw new DescriptionException("Duplicate operation '" + operation.name() + "'");
            }
        }
        this.operations = Collections.unmodifiableMap(byName);
        this.metadata = ApiDescription.freeze(metadata);
    }

    private ApiConfig(ApiConfig source, Duration timeout, boolean debug) {
        this(source.name, source.version, source.endpoint, timeout, debug,
            source.exceptions, List.copyOf(source.operations.values()), source.metadata);
    }

    public String name() {
        return name;
    }

    public String version() {
        return version;
    }

    public Endpoint endpoint() {
        return endpoint;
    }

    /**
     * 클라이언트 호출마다 적용되는 타임아웃.
     */
    public Duration timeout() {
        return timeout;
    }

    /**
     * 디버그 모드에서는 모든 예외가 실제 이름과 인자 그대로 전송됨.
     */
    public boolean debug() {
        return debug;
    }

    /**
     * 가리지 않고 그대로 전송할 수 있는 예외 이름 목록.
     */
    public Set<String> exceptions() {
        return exceptions;
    }

    public boolean isWhitelisted(String faultName) {
        return exceptions.contains(faultName);
    }

    public Map<String, OperationDescriptor> operations() {
        return operations;
    }

    public boolean hasOperation(String operation) {
        return operation != null && operations.containsKey(operation);
    }

    /**
     * 이름으로 오퍼레이션 조회.
     *
     * @param operation 오퍼레이션 이름
     * @return 디스크립터
     * @throws DescriptionException 선언되지 않은 오퍼레이션인 경우
     */
    public OperationDescriptor operation(String operation) {
        OperationDescriptor descriptor = operation == null ? null : operations.get(operation);
        if (descriptor == null) {
            throw new DescriptionException("Unknown operation '" + operation + "'");
        }
        return descriptor;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public ApiConfig withTimeout(Duration timeout) {
        return new ApiConfig(this, timeout, debug);
    }

    public ApiConfig withDebug(boolean debug) {
        return new ApiConfig(this, timeout, debug);
    }

    /**
     * 클라이언트용 포맷 문자열 (예: {@code http://localhost:8080/api/0/{operation}}).
     *
     * @return {@value Endpoint#OPERATION_PLACEHOLDER}를 하나 포함한 포맷 문자열
     * @throws DescriptionException scheme, host, port, pattern 중 하나라도 없는 경우
     */
    public String clientFormat() {
        String format = clientFormat;
        if (format == null) {
            require(endpoint.scheme(), "scheme");
            require(endpoint.host(), "host");
            require(endpoint.port(), "port");
            require(endpoint.pattern(), "pattern");
            format = endpoint.scheme() + "://" + endpoint.host() + ":" + endpoint.port() + versionedPattern();
            clientFormat = format;
        }
        return format;
    }

    /**
     * 오퍼레이션 호출 URI.
     *
     * @param operation 오퍼레이션 이름
     * @return URI 문자열
     */
    public String uriFor(String operation) {
        return clientFormat().replace(Endpoint.OPERATION_PLACEHOLDER, operation);
    }

    /**
     * {@code operation} 이름 그룹을 가진 서비스용 경로 매처.
     * 끝의 슬래시 하나는 허용합니다.
     *
     * @return 컴파일된 패턴
     * @throws DescriptionException 엔드포인트에 pattern이 없는 경우
     */
    public Pattern serviceMatcher() {
        Pattern matcher = serviceMatcher;
        if (matcher == null) {
            require(endpoint.pattern(), "pattern");
            String path = versionedPattern();
            int at = path.indexOf(Endpoint.OPERATION_PLACEHOLDER);
            String prefix = path.substring(0, at);
            String suffix = path.substring(at + Endpoint.OPERATION_PLACEHOLDER.length());
            matcher = Pattern.compile(
                "^" + quote(prefix) + "(?<" + OPERATION_GROUP + ">[^/]+)" + quote(suffix) + "/?$");
            serviceMatcher = matcher;
        }
        return matcher;
    }

    /**
     * 요청 경로에서 오퍼레이션 이름 추출.
     *
     * @param path 요청 경로
     * @return 오퍼레이션 이름, 매칭되지 않으면 empty
     */
    public Optional<String> matchOperation(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher matcher = serviceMatcher().matcher(path);
        return matcher.matches() ? Optional.of(matcher.group(OPERATION_GROUP)) : Optional.empty();
    }

    private String versionedPattern() {
        return endpoint.pattern().replace(Endpoint.VERSION_PLACEHOLDER, version);
    }

    private static String quote(String literal) {
        return literal.isEmpty() ? "" : Pattern.quote(literal);
    }

    private static void require(Object part, String key) {
        if (part == null || (part instanceof String s && s.isBlank())) {
            throw new DescriptionException("Endpoint is missing '" + key + "'");
        }
    }

    @Override
    public String toString() {
        return "ApiConfig{" + name + " v" + version + ", operations=" + operations.keySet() + '}';
    }
}
