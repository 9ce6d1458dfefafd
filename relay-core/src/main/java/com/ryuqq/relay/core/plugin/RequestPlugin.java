package com.ryuqq.relay.core.plugin;

import com.ryuqq.relay.core.processor.Context;
import com.ryuqq.relay.core.statemachine.ProcessorScope;

/**
 * request 스코프 플러그인.
 *
 * <p>서비스 측에서는 요청 본문 디코딩 전과 응답 본문 인코딩 후에 실행됩니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
@FunctionalInterface
public non-sealed interface RequestPlugin extends Plugin {

    void handle(Context context) throws Exception;

    @Override
    default ProcessorScope scope() {
        return ProcessorScope.REQUEST;
    }
}
