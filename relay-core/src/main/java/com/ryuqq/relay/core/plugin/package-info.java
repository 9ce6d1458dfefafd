/**
 * 스코프별 미들웨어.
 *
 * <p>두 가지 플러그인 형태가 같은 계속(continuation) 계약을 공유합니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.relay.core.plugin.RequestPlugin} - {@code (context)}</li>
 *   <li>{@link com.ryuqq.relay.core.plugin.OperationPlugin} - {@code (request, response, context)}</li>
 * </ul>
 *
 * <p>플러그인은 등록 순서대로 실행됩니다. 둘 다 proceed하는 request 플러그인 P1, P2가 있으면
 * proceed 이전 작업은 P1, P2 순서로, 이후 작업은 P2, P1 순서로 실행됩니다.</p>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.plugin;
