package com.teambind.checkout.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 금액 반올림 유틸리티
 * 모든 금액 변경은 소수점 둘째 자리로 즉시 반올림한다.
 */
public final class MoneyUtils {

    public static final int SCALE = 2;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private MoneyUtils() {
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_EVEN);
    }

    /**
     * 두 금액을 더한 뒤 반올림 (round-then-accumulate)
     */
    public static BigDecimal addRounded(BigDecimal total, BigDecimal delta) {
        return round(total.add(delta));
    }
}
