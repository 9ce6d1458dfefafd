package com.ryuqq.relay.core.processor;

/**
 * 이미 실행된 Processor에서 {@link Processor#process()}를 다시 호출한 경우 발생.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class AlreadyProcessedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public AlreadyProcessedException(String message) {
        super(message);
    }
}
