package com.teambind.checkout.application.port.in;

/**
 * 체크아웃 세션 시작 UseCase
 */
public interface OpenCheckoutUseCase {

    /**
     * 현재 스킴에 연결된 새 세션 생성
     */
    CheckoutView openCheckout();
}
