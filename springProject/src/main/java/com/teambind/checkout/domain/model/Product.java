package com.teambind.checkout.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 일반 상품
 * 스캔 시 판매가가 합계에 더해진다.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Product implements Item {

    @EqualsAndHashCode.Include
    private final String id;
    private final BigDecimal price;

    public Product(String id, BigDecimal price) {
        this.id = Objects.requireNonNull(id, "id");
        this.price = Objects.requireNonNull(price, "price");
    }

    public static Product of(String id, String price) {
        return new Product(id, new BigDecimal(price));
    }

    @Override
    public ItemKind getKind() {
        return ItemKind.PRODUCT;
    }

    @Override
    public BigDecimal getIntrinsicValue() {
        return price;
    }

    @Override
    public BigDecimal getNominalValue() {
        return price;
    }
}
