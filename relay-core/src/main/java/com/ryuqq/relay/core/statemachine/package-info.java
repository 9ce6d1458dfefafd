/**
 * Processor 스코프 상태 머신.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.statemachine.ProcessorScope} - 디스패치 단계 (enum)</li>
 *   <li>{@link com.ryuqq.relay.core.statemachine.ScopeTransition} - 스코프 전진 규칙</li>
 * </ul>
 *
 * <h2>전진 규칙</h2>
 * <pre>
 * REQUEST → OPERATION → FUNCTION → DONE
 *
 * 금지:
 * - DONE 이후 전진 (종료 스코프)
 * - 스코프 건너뛰기 (예: REQUEST → FUNCTION)
 * - 역방향 이동
 * </pre>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.statemachine;
