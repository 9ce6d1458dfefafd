package com.ryuqq.relay.application.client;

import com.ryuqq.relay.core.fault.ExceptionRegistry;
import com.ryuqq.relay.core.fault.RequestException;
import com.ryuqq.relay.core.fault.WireFault;
import com.ryuqq.relay.core.model.ApiConfig;
import com.ryuqq.relay.core.model.Container;
import com.ryuqq.relay.core.plugin.PluginRegistry;
import com.ryuqq.relay.core.processor.Processor;
import com.ryuqq.relay.core.spi.Codec;
import com.ryuqq.relay.core.spi.CodecException;
import com.ryuqq.relay.core.spi.Transport;
import com.ryuqq.relay.core.spi.TransportException;
import com.ryuqq.relay.core.spi.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Map;

/**
 * 클라이언트 측 Processor. 최종 동작은 원격 호출 자체입니다.
 *
 * <p><strong>execute() 동작 방식:</strong></p>
 * <ol>
 *   <li>request 컨테이너 인코딩</li>
 *   <li>설정된 타임아웃으로 오퍼레이션 URI에 POST</li>
 *   <li>전송 실패 또는 2xx가 아닌 상태 → {@code RequestException("<status> <reason>")}</li>
 *   <li>본문을 response 컨테이너로 디코딩</li>
 *   <li>{@code __exception__}이 있으면 클라이언트 레지스트리로 복원한 예외를 던짐</li>
 * </ol>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ClientProcessor extends Processor<Container> {

    private static final Logger log = LoggerFactory.getLogger(ClientProcessor.class);

    private final ApiConfig api;
    private final ExceptionRegistry exceptions;
    private final Transport transport;
    private final Codec codec;

    public ClientProcessor(ApiConfig api,
                           PluginRegistry plugins,
                           ExceptionRegistry exceptions,
                           Transport transport,
                           Codec codec,
                           String operation,
                           Map<String, ?> arguments) {
        super(plugins, operation);
        if (api == null || exceptions == null || transport == null || codec == null) {
            throw new IllegalArgumentException("api, exceptions, transport and codec cannot be null");
        }
        this.api = api;
        this.exceptions = exceptions;
        this.transport = transport;
        this.codec = codec;
        if (arguments != null) {
            request().putAll(arguments);
        }
    }

    @Override
    protected void execute() {
        requestBody(codec.serialize(request().asMap()));
        URI uri = URI.create(api.uriFor(operation()));

        TransportResponse reply;
        try {
            reply = transport.post(uri, requestBody(), api.timeout());
        } catch (TransportException e) {
            throw new RequestException(e, e.status() + " " + e.getMessage());
        }
        log.debug("POST {} -> {} {}", uri, reply.status(), reply.reason());
        if (!reply.isSuccess()) {
            throw new RequestException(reply.status() + " " + reply.reason());
        }
        responseBody(reply.text());

        try {
            response().putAll(codec.deserialize(reply.text()));
        } catch (CodecException e) {
            throw new InvalidResponseException("Undecodable response for operation '" + operation() + "'", e);
        }

        if (response().containsKey(WireFault.RESERVED_KEY)) {
            RuntimeException fault;
            try {
                WireFault wire = WireFault.parse(response().get(WireFault.RESERVED_KEY));
                fault = exceptions.get(wire.cls()).newInstance(wire.args());
            } catch (IllegalArgumentException e) {
                // 잘못된 payload 또는 식별자 규칙을 벗어난 예외 이름
                throw new InvalidResponseException(e.getMessage(), e);
            }
            if (!api.debug()) {
                response().clear();
            }
            throw fault;
        }
    }

    @Override
    protected Container result() {
        return response();
    }
}
