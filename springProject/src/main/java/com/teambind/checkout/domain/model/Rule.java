package com.teambind.checkout.domain.model;

import com.teambind.checkout.common.util.MoneyUtils;
import com.teambind.checkout.domain.exception.CheckoutDomainException;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * 번들/쿠폰 가격 조정 규칙
 *
 * 조정 금액(adjustment)은 생성 시 한 번만 계산된다:
 * round(targetAmount - sum(intrinsicValue of requiredItems), 2)
 * 음수는 할인, 양수는 추가 금액이다.
 */
@Getter
@ToString(of = {"name", "targetAmount", "adjustment"})
public final class Rule {

    private final String name;
    private final List<Item> requiredItems;
    private final BigDecimal targetAmount;
    private final BigDecimal adjustment;

    @Getter(lombok.AccessLevel.NONE)
    private final ItemMultiset requiredSet;

    public Rule(String name, List<? extends Item> requiredItems, BigDecimal targetAmount) {
        if (name == null || name.isBlank()) {
            throw new CheckoutDomainException.DefinitionError("규칙 이름은 필수입니다");
        }
        if (requiredItems == null || requiredItems.isEmpty()) {
            throw new CheckoutDomainException.DefinitionError("규칙에 필요한 상품이 없습니다: " + name);
        }
        if (targetAmount == null) {
            throw new CheckoutDomainException.DefinitionError("규칙 금액은 필수입니다: " + name);
        }
        this.name = name;
        this.requiredItems = List.copyOf(requiredItems);
        this.targetAmount = targetAmount;
        this.requiredSet = ItemMultiset.of(this.requiredItems);
        this.adjustment = calculateAdjustment();
    }

    private BigDecimal calculateAdjustment() {
        // 쿠폰의 intrinsicValue 는 0 이므로 상품 가격만 합산된다
        BigDecimal priorSum = requiredItems.stream()
                .map(Item::getIntrinsicValue)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return MoneyUtils.round(targetAmount.subtract(priorSum));
    }

    public boolean requires(String itemId) {
        return requiredSet.contains(itemId);
    }

    public boolean requires(Item item) {
        return requires(item.getId());
    }

    /**
     * 두 단위 이상을 요구하는 규칙만 적용 시 상품을 소비한다
     */
    public boolean isMultiItem() {
        return requiredItems.size() > 1;
    }

    public boolean matches(ItemMultiset pending) {
        return requiredSet.isSubMultisetOf(pending);
    }

    /**
     * 규칙 적용 후 대기 목록에 남는 단위 수
     */
    public int leftoverAgainst(ItemMultiset pending) {
        return pending.differenceSum(requiredSet);
    }

    public List<String> getRequiredItemIds() {
        return requiredItems.stream().map(Item::getId).toList();
    }
}
