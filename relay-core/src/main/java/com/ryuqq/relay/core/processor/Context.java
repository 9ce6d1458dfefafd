package com.ryuqq.relay.core.processor;

import com.ryuqq.relay.core.model.Container;

/**
 * 호출 단위 컨텍스트 (모든 플러그인과 핸들러에 전달).
 *
 * <p>한 호출 안에서 플러그인끼리 상태를 공유하는 자유 형식 {@link Container}이면서,
 * 계속 지점인 {@link #proceed()}를 제공합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class Context extends Container {

    private final String operation;
    private final Processor<?> processor;

    Context(String operation, Processor<?> processor) {
        this.operation = operation;
        this.processor = processor;
    }

    /**
     * 호출 중인 오퍼레이션 이름.
     */
    public String operation() {
        return operation;
    }

    /**
     * 요청 원문. 아직 인코딩/수신 전이면 null.
     */
    public String requestBody() {
        return processor.requestBody();
    }

    /**
     * 응답 원문.
     *
     * <p>서비스 측에서는 OPERATION 스코프를 빠져나올 때 설정되므로, request 플러그인은
     * {@link #proceed()} 반환 후 읽을 수 있습니다.</p>
     */
    public String responseBody() {
        return processor.responseBody();
    }

    /**
     * 파이프라인의 나머지를 실행하고, 모두 끝나면 반환.
     *
     * <p>플러그인 호출당 최대 한 번만 호출할 수 있습니다. 핸들러 안에서는 아무 동작도 하지 않습니다.</p>
     *
     * @throws Exception 나머지 파이프라인에서 발생한 예외
     * @throws IllegalStateException 한 플러그인이 두 번 호출하거나 디스패치 밖에서 호출한 경우
     */
    public void proceed() throws Exception {
        processor.proceed();
    }
}
