package com.teambind.checkout.application.port.in;

import com.teambind.checkout.domain.model.Checkout;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * 체크아웃 세션 조회 결과
 */
@Value
@Builder
public class CheckoutView {
    Long checkoutId;
    BigDecimal total;
    List<String> pendingItemIds;

    public static CheckoutView from(Checkout checkout) {
        return CheckoutView.builder()
                .checkoutId(checkout.getId())
                .total(checkout.getTotal())
                .pendingItemIds(checkout.getPendingItemIds())
                .build();
    }
}
