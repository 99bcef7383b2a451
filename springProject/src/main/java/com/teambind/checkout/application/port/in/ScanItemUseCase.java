package com.teambind.checkout.application.port.in;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * 상품 스캔 UseCase
 */
public interface ScanItemUseCase {

    /**
     * 상품 스캔
     * 스킴에 없는 상품은 실패 결과로 반환되며 세션 상태는 변하지 않는다.
     *
     * @param command 스캔 요청
     * @return 스캔 결과
     * @throws com.teambind.checkout.domain.exception.CheckoutDomainException.CheckoutNotFound 세션이 없을 때
     */
    ScanResult scan(ScanItemCommand command);

    /**
     * 스캔 결과
     */
    @Value
    @Builder
    class ScanResult {
        Long checkoutId;
        String itemId;
        boolean success;
        BigDecimal scannedValue;
        String appliedRule;
        BigDecimal adjustment;
        BigDecimal total;
        String message;

        public boolean isRuleApplied() {
            return appliedRule != null;
        }
    }
}
