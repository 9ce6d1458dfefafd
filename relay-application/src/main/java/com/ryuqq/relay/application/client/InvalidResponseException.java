package com.ryuqq.relay.application.client;

/**
 * 서비스가 응답했지만 본문이 유효한 응답이 아닌 경우 발생.
 *
 * <p>디코딩 실패, 잘못된 {@code __exception__} payload, 선언된 출력 누락이 해당합니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InvalidResponseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InvalidResponseException(String message) {
        super(message);
    }

    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
