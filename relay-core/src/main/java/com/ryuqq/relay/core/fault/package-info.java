/**
 * 클라이언트와 서비스가 공유하는 예외 모델.
 *
 * <p>서비스에서 발생한 예외는 {@code {"__exception__": {"cls": name, "args": [...]}}} 형태로
 * 기록되고, 클라이언트에서 {@link com.ryuqq.relay.core.fault.ExceptionRegistry}를 통해
 * 다시 만들어집니다.</p>
 *
 * <p><strong>전송 규칙:</strong></p>
 * <ul>
 *   <li>화이트리스트에 있는 이름 (디버그 모드면 모든 이름): 그대로 전송</li>
 *   <li>그 외: {@code RequestException(500)}으로 가려서 전송</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.fault;
