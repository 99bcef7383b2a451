package com.teambind.checkout.application.port.in;

/**
 * 체크아웃 종료 UseCase
 */
public interface CloseCheckoutUseCase {

    /**
     * 세션을 종료하고 최종 합계를 반환한다. 종료된 세션은 더 이상 조회되지 않는다.
     *
     * @throws com.teambind.checkout.domain.exception.CheckoutDomainException.CheckoutNotFound 세션이 없을 때
     */
    CheckoutView closeCheckout(Long checkoutId);
}
