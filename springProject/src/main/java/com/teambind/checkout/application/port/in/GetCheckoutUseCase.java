package com.teambind.checkout.application.port.in;

/**
 * 체크아웃 조회 UseCase
 */
public interface GetCheckoutUseCase {

    /**
     * @throws com.teambind.checkout.domain.exception.CheckoutDomainException.CheckoutNotFound 세션이 없을 때
     */
    CheckoutView getCheckout(Long checkoutId);
}
