package com.ryuqq.relay.core.statemachine;

/**
 * Processor 스코프 전진 규칙.
 *
 * <p>스코프는 {@link ProcessorScope#next()}가 가리키는 바로 다음 단계로만
 * 이동합니다. 건너뛰기나 되돌아가기는 Processor 내부 상태가 깨졌다는 뜻이므로
 * 즉시 실패합니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>{@code
 * scope = ScopeTransition.advance(scope);           // REQUEST → OPERATION
 * boolean ok = ScopeTransition.isAllowed(FUNCTION, DONE);
 * }</pre>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public final class ScopeTransition {

    private ScopeTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * {@code from → to} 이동이 허용되는지 여부.
     *
     * <p>null이 섞여 있거나 DONE에서 출발하면 항상 false입니다.</p>
     *
     * @param from 현재 스코프
     * @param to 이동할 스코프
     * @return 바로 다음 스코프로의 이동이면 true
     */
    public static boolean isAllowed(ProcessorScope from, ProcessorScope to) {
        return from != null && to != null && !from.isTerminal() && from.next() == to;
    }

    /**
     * 다음 스코프로 전진.
     *
     * @param current 현재 스코프
     * @return 바로 다음 스코프
     * @throws IllegalArgumentException current가 null인 경우
     * @throws IllegalStateException current가 DONE인 경우
     */
    public static ProcessorScope advance(ProcessorScope current) {
        if (current == null) {
            throw new IllegalArgumentException("Current scope must not be null");
        }
        if (current.isTerminal()) {
            throw new IllegalStateException("Processor already reached " + current + "; no further scope");
        }
        return current.next();
    }

    /**
     * 목표 스코프가 바로 다음 단계일 때만 전진.
     *
     * @param current 현재 스코프
     * @param target 기대하는 다음 스코프
     * @return target
     * @throws IllegalArgumentException 인자 중 하나가 null인 경우
     * @throws IllegalStateException target이 바로 다음 단계가 아닌 경우
     */
    public static ProcessorScope advanceTo(ProcessorScope current, ProcessorScope target) {
        if (target == null) {
            throw new IllegalArgumentException("Target scope must not be null");
        }
        ProcessorScope next = advance(current);
        if (next != target) {
            throw new IllegalStateException(
                "Scope " + current + " moves to " + next + ", not " + target);
        }
        return next;
    }
}
