package com.teambind.checkout.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MoneyUtils 단위 테스트
 * 금액은 정확한 10진수로 다루며 정확히 절반인 값은 짝수 쪽으로 반올림한다.
 */
@DisplayName("MoneyUtils 테스트")
class MoneyUtilsTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "2.675, 2.68",
            "2.665, 2.66",
            "2.685, 2.68",
            "0.125, 0.12",
            "-0.505, -0.50",
            "1.994, 1.99",
            "1.996, 2.00"
    })
    @DisplayName("소수점 둘째 자리 HALF_EVEN 반올림")
    void round(String amount, String expected) {
        BigDecimal rounded = MoneyUtils.round(new BigDecimal(amount));

        assertThat(rounded).isEqualTo(new BigDecimal(expected));
        assertThat(rounded.scale()).isEqualTo(MoneyUtils.SCALE);
    }

    @Test
    @DisplayName("더할 때마다 반올림한다")
    void addRounded() {
        // given
        BigDecimal total = MoneyUtils.ZERO;

        // when
        total = MoneyUtils.addRounded(total, new BigDecimal("0.005"));
        total = MoneyUtils.addRounded(total, new BigDecimal("0.005"));

        // then
        // 누적 후 한 번 반올림하면 0.01 이 되지만 매번 반올림하면 0.00 에 머문다
        assertThat(total).isEqualTo(new BigDecimal("0.00"));
    }
}
