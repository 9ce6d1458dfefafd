package com.ryuqq.relay.core.statemachine;

/**
 * 호출 하나의 디스패치 단계.
 *
 * <p><strong>전이 규칙:</strong></p>
 * <ul>
 *   <li>REQUEST → OPERATION (request 스코프 플러그인 소진)</li>
 *   <li>OPERATION → FUNCTION (operation 스코프 플러그인 소진)</li>
 *   <li>FUNCTION → DONE (최종 동작 1회 실행)</li>
 *   <li><strong>역방향 및 건너뛰기 불가</strong></li>
 * </ul>
 *
 * <pre>
 * REQUEST
 *    │  request 플러그인 (context)
 *    ▼
 * OPERATION
 *    │  operation 플러그인 (request, response, context)
 *    ▼
 * FUNCTION
 *    │  execute(): 원격 호출 또는 핸들러
 *    ▼
 * DONE
 * </pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public enum ProcessorScope {

    /**
     * request 스코프 플러그인 실행 단계. 서비스 측에서는 요청 본문이 아직 디코딩 전 문자열.
     */
    REQUEST,

    /**
     * 디코딩된 request/response 컨테이너에 대해 operation 스코프 플러그인 실행.
     */
    OPERATION,

    /**
     * 최종 동작 실행.
     */
    FUNCTION,

    /**
     * 종료 스코프.
     */
    DONE;

    /**
     * 다음 스코프.
     *
     * @return 바로 다음 스코프
     * @throws IllegalStateException {@link #DONE}에서 호출한 경우
     */
    public ProcessorScope next() {
        return switch (this) {
            case REQUEST -> OPERATION;
            case OPERATION -> FUNCTION;
            case FUNCTION -> DONE;
            case DONE -> throw new IllegalStateException("DONE has no successor scope");
        };
    }

    /**
     * 플러그인이 등록되는 스코프인지 여부.
     *
     * @return REQUEST, OPERATION이면 true
     */
    public boolean hasPlugins() {
        return this == REQUEST || this == OPERATION;
    }

    public boolean isTerminal() {
        return this == DONE;
    }
}
