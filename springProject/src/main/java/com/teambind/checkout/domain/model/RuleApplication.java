package com.teambind.checkout.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * 규칙 적용 기록
 */
@Value
@Builder
public class RuleApplication {
    Long checkoutId;
    String ruleName;
    BigDecimal adjustment;
    List<String> itemIds;
    boolean consumed; // 대기 목록에서 제거되었는지 여부
    BigDecimal totalAfter;
}
