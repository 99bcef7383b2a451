package com.teambind.checkout.application.port.out;

import com.teambind.checkout.domain.model.Checkout;

/**
 * 체크아웃 세션 저장 포트
 */
public interface SaveCheckoutPort {

    Checkout save(Checkout checkout);
}
