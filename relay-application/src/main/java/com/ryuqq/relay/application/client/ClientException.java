package com.ryuqq.relay.application.client;

/**
 * 클라이언트 측 플러그인이 던진 checked 예외를 감싸는 예외.
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class ClientException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
