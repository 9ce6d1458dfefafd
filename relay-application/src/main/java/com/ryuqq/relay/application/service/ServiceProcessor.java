package com.ryuqq.relay.application.service;

import com.ryuqq.relay.core.fault.Faults;
import com.ryuqq.relay.core.fault.WireFault;
import com.ryuqq.relay.core.model.ApiConfig;
import com.ryuqq.relay.core.plugin.PluginRegistry;
import com.ryuqq.relay.core.processor.AlreadyProcessedException;
import com.ryuqq.relay.core.processor.Processor;
import com.ryuqq.relay.core.spi.Codec;
import com.ryuqq.relay.core.spi.CodecException;
import com.ryuqq.relay.core.statemachine.ProcessorScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 서비스 측 Processor. 요청 본문을 디코딩하고 핸들러를 실행한 뒤 응답이나 예외를 인코딩합니다.
 *
 * <p><strong>스코프 훅:</strong></p>
 * <ul>
 *   <li>{@code enterScope(OPERATION)}: 요청 본문 → request 컨테이너 (operation 플러그인과 핸들러보다 먼저)</li>
 *   <li>{@code exitScope(OPERATION)}: response 컨테이너 → 응답 본문 (request 플러그인의 proceed 이후 작업보다 먼저)</li>
 * </ul>
 *
 * <p><strong>예외 경계:</strong> 예외는 {@link #process()}에서만 잡습니다. response 컨테이너를 비우고
 * {@code __exception__} payload로 바꾸며, 화이트리스트에 있거나 디버그 모드이면 실제 이름과 인자를,
 * 그 외에는 {@code RequestException(500)}을 씁니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ServiceProcessor extends Processor<String> {

    private static final Logger log = LoggerFactory.getLogger(ServiceProcessor.class);

    private final ApiConfig api;
    private final Codec codec;
    private final OperationHandler handler;

    public ServiceProcessor(ApiConfig api,
                            PluginRegistry plugins,
                            Codec codec,
                            OperationHandler handler,
                            String operation,
                            String body) {
        super(plugins, operation);
        if (api == null || codec == null || handler == null) {
            throw new IllegalArgumentException("api, codec and handler cannot be null");
        }
        this.api = api;
        this.codec = codec;
        this.handler = handler;
        requestBody(body == null ? "" : body);
    }

    /**
     * 파이프라인을 실행하고 인코딩된 응답 반환.
     *
     * <p>파이프라인 안에서 발생한 예외는 던지지 않고 {@code __exception__} 본문으로 반환합니다.</p>
     *
     * @return 인코딩된 응답 본문
     * @throws AlreadyProcessedException 두 번째 호출인 경우
     */
    @Override
    public String process() {
        if (isProcessed()) {
            throw new AlreadyProcessedException("Already processed request for operation '" + operation() + "'");
        }
        try {
            return super.process();
        } catch (Exception e) {
            return marshal(e);
        }
    }

    @Override
    protected void enterScope(ProcessorScope scope) {
        if (scope == ProcessorScope.OPERATION) {
            request().putAll(codec.deserialize(requestBody()));
        }
    }

    @Override
    protected void exitScope(ProcessorScope scope) {
        if (scope == ProcessorScope.OPERATION) {
            responseBody(codec.serialize(response().asMap()));
        }
    }

    @Override
    protected void execute() throws Exception {
        handler.handle(request(), response(), context());
    }

    @Override
    protected String result() {
        if (responseBody() == null) {
            // request 플러그인이 OPERATION 스코프 진입 전에 호출을 끊음
            responseBody(codec.serialize(response().asMap()));
        }
        return responseBody();
    }

    private String marshal(Exception fault) {
        WireFault wire;
        String name = Faults.nameOf(fault);
        if (api.debug() || api.isWhitelisted(name)) {
            log.debug("Marshalling fault {} for operation '{}'", name, operation());
            wire = WireFault.of(fault);
        } else {
            log.warn("Redacting non-whitelisted fault {} for operation '{}'", name, operation(), fault);
            wire = WireFault.redacted();
        }

        response().clear();
        response().putAll(wire.toPayload());
        try {
            responseBody(codec.serialize(response().asMap()));
        } catch (CodecException e) {
            log.warn("Fault args for {} are not encodable, sending generic fault instead", name, e);
            response().clear();
            response().putAll(WireFault.redacted().toPayload());
            responseBody(codec.serialize(response().asMap()));
        }
        return responseBody();
    }
}
