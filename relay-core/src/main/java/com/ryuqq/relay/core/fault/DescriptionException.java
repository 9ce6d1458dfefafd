package com.ryuqq.relay.core.fault;

/**
 * API 기술, 오퍼레이션 이름, 필드 목록의 형식이 잘못된 경우 발생.
 *
 * <p>클라이언트/서비스 구성 시점에만 발생하는 로컬 예외로, 처리 파이프라인을 거치거나
 * 와이어로 직렬화되지 않습니다.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class DescriptionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public DescriptionException(String message) {
        super(message);
    }

    public DescriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
