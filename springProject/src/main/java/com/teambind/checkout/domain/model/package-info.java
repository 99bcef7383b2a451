/**
 * Domain Models
 * 체크아웃 가격 계산 도메인 모델
 *
 * 주요 Model:
 * - Scheme: 상품/규칙 카탈로그 (Aggregate Root, 불변)
 * - Checkout: 스캔 세션 상태 (대기 상품, 합계)
 * - Rule: 번들/쿠폰 조정 규칙
 * - Product, Coupon: 스캔 가능한 항목 (Item)
 * - ItemMultiset: 규칙 매칭용 다중집합
 */
package com.teambind.checkout.domain.model;
