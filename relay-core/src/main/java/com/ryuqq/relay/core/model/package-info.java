/**
 * API 기술(description) 모델.
 *
 * <p>이름 규칙, 엔드포인트, 오퍼레이션 선언과 기본값이 병합된 설정을 담습니다.</p>
 *
 * @since 1.0.0
 * @author Relay Team
 */
package com.ryuqq.relay.core.model;
