package com.ryuqq.relay.application.service;

/**
 * {@link Service#dispatch(String, String)}가 만든 상태와 본문.
 *
 * <p>애플리케이션 예외는 상태 200과 {@code __exception__} 본문으로 전달됩니다.
 * 라우팅 실패만 다른 상태를 사용합니다.</p>
 *
 * @param status HTTP 스타일 상태 코드
 * @param body 인코딩된 응답 (없으면 빈 문자열)
 * @author Relay Team
 * @since 1.0.0
 */
public record ServiceResponse(int status, String body) {

    public static final int OK = 200;
    public static final int NOT_FOUND = 404;

    public ServiceResponse {
        body = body == null ? "" : body;
    }

    public static ServiceResponse ok(String body) {
        return new ServiceResponse(OK, body);
    }

    public static ServiceResponse notFound() {
        return new ServiceResponse(NOT_FOUND, "");
    }

    public boolean isSuccess() {
        return status == OK;
    }
}
