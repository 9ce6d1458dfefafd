package com.ryuqq.relay.application.service;

import com.ryuqq.relay.core.fault.DescriptionException;
import com.ryuqq.relay.core.fault.ExceptionRegistry;
import com.ryuqq.relay.core.model.ApiConfig;
import com.ryuqq.relay.core.model.ApiDescription;
import com.ryuqq.relay.core.plugin.Plugin;
import com.ryuqq.relay.core.plugin.PluginRegistry;
import com.ryuqq.relay.core.spi.Codec;
import com.ryuqq.relay.core.statemachine.ProcessorScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * API 하나에 대한 서버 측 디스패처.
 *
 * <p><strong>생명주기:</strong></p>
 * <ol>
 *   <li>선언된 모든 오퍼레이션에 핸들러 바인딩 ({@link #operation(String, OperationHandler)})</li>
 *   <li>플러그인 등록 ({@link #plugin(Plugin)})</li>
 *   <li>선택적으로 {@link #checkHandlers()}로 검증</li>
 *   <li>서빙: {@link #process(String, String)} 또는 {@link #dispatch(String, String)}</li>
 * </ol>
 *
 * <p>첫 호출에서 플러그인 레지스트리와 핸들러 바인딩이 고정됩니다. 그 이후에는 동시 사용이
 * 안전하며, 호출마다 별도의 {@link ServiceProcessor}가 생성됩니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * Service service = new Service(api, new JacksonCodec());
 * service.operation("upper", (request, response, context) -&gt;
 *     response.set("result", request.get("text", String.class).toUpperCase()));
 * String body = service.process("upper", "{\"text\":\"hi\"}");
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class Service {

    private static final Logger log = LoggerFactory.getLogger(Service.class);

    private final ApiConfig api;
    private final Codec codec;
    private final PluginRegistry plugins = new PluginRegistry();
    private final ExceptionRegistry exceptions = new ExceptionRegistry();
    private final Map<String, OperationHandler> handlers = new ConcurrentHashMap<>();

    public Service(ApiConfig api, Codec codec) {
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.api = api;
        this.codec = codec;
    }

    public static Service fromDescription(Map<String, ?> description, Codec codec) {
        return new Service(ApiDescription.fromDescription(description), codec);
    }

    /**
     * 선언된 오퍼레이션에 {@code handler} 바인딩.
     *
     * @param name 오퍼레이션 이름
     * @param handler 구현
     * @return 이 서비스
     * @throws DescriptionException 선언되지 않은 오퍼레이션인 경우
     * @throws IllegalStateException 이미 바인딩됐거나 서비스가 이미 호출을 처리한 경우
     */
    public synchronized Service operation(String name, OperationHandler handler) {
        api.operation(name);
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (plugins.isFrozen()) {
            throw new IllegalStateException(
                "Cannot bind operation '" + name + "' after the service has processed a call");
        }
        if (handlers.putIfAbsent(name, handler) != null) {
            throw new IllegalStateException("Operation '" + name + "' is already bound");
        }
        return this;
    }

    /**
     * 플러그인을 해당 스코프에 등록.
     *
     * @throws IllegalStateException 서비스가 이미 호출을 처리한 경우
     */
    public <P extends Plugin> P plugin(P plugin) {
        return plugins.register(plugin);
    }

    /**
     * 핸들러가 없는 오퍼레이션이 있으면 실패.
     *
     * @throws IllegalStateException 바인딩되지 않은 오퍼레이션 목록과 함께
     */
    public void checkHandlers() {
        List<String> missing = api.operations().keySet().stream()
            .filter(name -> !handlers.containsKey(name))
            .toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Operations without a handler: " + missing);
        }
    }

    /**
     * 호출 하나 처리.
     *
     * @param operation 오퍼레이션 이름
     * @param body 인코딩된 요청
     * @return 인코딩된 응답 (애플리케이션 예외는 {@code __exception__} 본문)
     * @throws DescriptionException 선언되지 않은 오퍼레이션인 경우
     * @throws IllegalStateException 핸들러가 없는 경우
     */
    public String process(String operation, String body) {
        api.operation(operation);
        OperationHandler handler = handlers.get(operation);
        if (handler == null) {
            throw new IllegalStateException("Operation '" + operation + "' has no handler");
        }
        if (plugins.freeze()) {
            log.info("Service '{}' started serving; plugin registry frozen with {} request and {} operation plugins",
                api.name(),
                plugins.size(ProcessorScope.REQUEST),
                plugins.size(ProcessorScope.OPERATION));
        }
        return new ServiceProcessor(api, plugins, codec, handler, operation, body).process();
    }

    /**
     * 요청 경로를 오퍼레이션으로 라우팅한 뒤 호출 처리.
     *
     * @param path 요청 경로 (예: {@code /api/0/upper})
     * @param body 인코딩된 요청
     * @return 바인딩된 오퍼레이션과 매칭되지 않으면 빈 본문의 404, 그 외 200
     */
    public ServiceResponse dispatch(String path, String body) {
        Optional<String> operation = api.matchOperation(path)
            .filter(handlers::containsKey);
        if (operation.isEmpty()) {
            log.debug("No operation for path '{}'", path);
            return ServiceResponse.notFound();
        }
        ServiceResponse response = ServiceResponse.ok(process(operation.get(), body));
        log.debug("Dispatched '{}' to operation '{}' with status {}", path, operation.get(), response.status());
        return response;
    }

    public ApiConfig api() {
        return api;
    }

    public Codec codec() {
        return codec;
    }

    public PluginRegistry plugins() {
        return plugins;
    }

    public ExceptionRegistry exceptions() {
        return exceptions;
    }

    public boolean isBound(String operation) {
        return handlers.containsKey(operation);
    }
}
