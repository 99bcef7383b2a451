/**
 * REST API Controllers
 * 체크아웃 세션 HTTP 요청을 처리하는 웹 어댑터 레이어
 *
 * 주요 컨트롤러:
 * - CheckoutController: 세션 생성, 상품 스캔, 합계 조회 API
 */
package com.teambind.checkout.adapter.in.web;
