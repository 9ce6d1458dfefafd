/**
 * 서비스 측 구성 요소.
 *
 * <p>핸들러 바인딩, 경로 라우팅, 예외 경계를 담당합니다.</p>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.application.service;
