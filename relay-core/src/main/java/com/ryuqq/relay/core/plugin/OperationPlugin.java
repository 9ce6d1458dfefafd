package com.ryuqq.relay.core.plugin;

import com.ryuqq.relay.core.model.Container;
import com.ryuqq.relay.core.processor.Context;
import com.ryuqq.relay.core.statemachine.ProcessorScope;

/**
 * operation 스코프 플러그인.
 *
 * <p>디코딩된 요청과 작성 중인 응답 컨테이너를 받습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface OperationPlugin extends Plugin {

    void handle(Container request, Container response, Context context) throws Exception;

    @Override
    default ProcessorScope scope() {
        return ProcessorScope.OPERATION;
    }
}
