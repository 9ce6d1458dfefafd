package com.ryuqq.relay.application.service;

import com.ryuqq.relay.core.model.Container;
import com.ryuqq.relay.core.processor.Context;

/**
 * 오퍼레이션 하나의 서버 측 구현.
 *
 * <p>{@code request}에서 입력을 읽고 {@code response}에 출력을 씁니다. 어떤 예외든 던질 수 있으며,
 * 예외 변환은 서비스가 담당합니다.</p>
 *
 * <pre>
 * service.operation("upper", (request, response, context) -&gt;
 *     response.set("result", request.get("text", String.class).toUpperCase()));
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OperationHandler {

    void handle(Container request, Container response, Context context) throws Exception;
}
