/**
 * Output Port Interfaces
 * 외부 리소스 접근을 위한 포트 인터페이스
 *
 * 주요 Port:
 * - LoadSchemePort: 가격 스킴 로딩
 * - SaveCheckoutPort / LoadCheckoutPort: 체크아웃 세션 저장소
 * - PublishRuleAppliedPort: 규칙 적용 이벤트 발행
 */
package com.teambind.checkout.application.port.out;
