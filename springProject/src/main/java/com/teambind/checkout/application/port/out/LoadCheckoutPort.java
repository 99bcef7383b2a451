package com.teambind.checkout.application.port.out;

import com.teambind.checkout.domain.model.Checkout;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 체크아웃 세션 조회 포트
 */
public interface LoadCheckoutPort {

    Optional<Checkout> loadById(Long checkoutId);

    /**
     * 기준 시각 이후 활동이 없는 세션 조회
     */
    List<Checkout> loadIdleSince(LocalDateTime cutoff);
}
