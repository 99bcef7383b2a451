package com.teambind.checkout.domain.model;

/**
 * 상품 종류
 */
public enum ItemKind {
    PRODUCT,
    COUPON;

    /**
     * 스킴 정의의 상품 ID로 종류 판별 ('C'로 시작하면 쿠폰)
     */
    public static ItemKind fromItemId(String itemId) {
        return itemId.startsWith("C") ? COUPON : PRODUCT;
    }
}
