package com.teambind.checkout.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 쿠폰
 * 단독 스캔으로는 합계가 변하지 않으며, 할인율은 규칙 계산식에서만 사용된다.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Coupon implements Item {

    @EqualsAndHashCode.Include
    private final String id;
    private final BigDecimal discountRate; // 0 ~ 1

    public Coupon(String id, BigDecimal discountRate) {
        this.id = Objects.requireNonNull(id, "id");
        this.discountRate = Objects.requireNonNull(discountRate, "discountRate");
    }

    public static Coupon of(String id, String discountRate) {
        return new Coupon(id, new BigDecimal(discountRate));
    }

    @Override
    public ItemKind getKind() {
        return ItemKind.COUPON;
    }

    @Override
    public BigDecimal getIntrinsicValue() {
        return BigDecimal.ZERO;
    }

    @Override
    public BigDecimal getNominalValue() {
        return discountRate;
    }
}
