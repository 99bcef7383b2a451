package com.teambind.checkout.domain.model;

import java.math.BigDecimal;

/**
 * 스캔 가능한 항목
 * 동일성은 ID로만 판단한다.
 */
public interface Item {

    String getId();

    ItemKind getKind();

    /**
     * 스캔만으로 합계에 더해지는 금액
     */
    BigDecimal getIntrinsicValue();

    /**
     * 규칙 금액 계산식에서 사용되는 값
     */
    BigDecimal getNominalValue();
}
