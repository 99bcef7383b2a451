/**
 * Input Port Interfaces (Use Cases)
 * 애플리케이션의 유스케이스 정의
 *
 * 주요 Use Case:
 * - OpenCheckoutUseCase: 체크아웃 세션 시작
 * - ScanItemUseCase: 상품 스캔
 * - GetCheckoutUseCase: 합계/대기 상품 조회
 */
package com.teambind.checkout.application.port.in;
