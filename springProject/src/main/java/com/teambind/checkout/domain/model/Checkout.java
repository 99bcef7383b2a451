package com.teambind.checkout.domain.model;

import com.teambind.checkout.common.util.MoneyUtils;
import com.teambind.checkout.domain.exception.CheckoutDomainException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 체크아웃 세션
 * 스캔 순서대로 상태를 변경하며 종료 상태가 없다.
 * 인스턴스는 스레드 안전하지 않다. 동시 접근은 호출자가 직렬화해야 한다.
 */
@Slf4j
public class Checkout {

    @Getter
    private final Long id;
    @Getter
    private final Scheme scheme;
    private final RuleAppliedListener listener;

    private final List<Item> pendingItems = new ArrayList<>();
    private final List<RuleApplication> appliedRules = new ArrayList<>();
    private BigDecimal total = MoneyUtils.ZERO;
    @Getter
    private volatile LocalDateTime lastActivityAt = LocalDateTime.now();

    public Checkout(Long id, Scheme scheme, RuleAppliedListener listener) {
        this.id = id;
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.listener = listener != null ? listener : RuleAppliedListener.NONE;
    }

    public static Checkout open(Scheme scheme) {
        return new Checkout(null, scheme, RuleAppliedListener.NONE);
    }

    /**
     * 상품 스캔
     *
     * 스킴에 없는 코드는 합계와 대기 목록을 바꾸지 않고 예외로 알린다.
     * 세션을 직접 사용하는 호출자는 이 예외를 잡아 스캔 단위로 처리해야 다음 스캔을 계속할 수 있다.
     * (서비스 계층에서는 CheckoutService 가 실패 결과로 변환한다)
     *
     * @param itemId 상품 코드
     * @throws CheckoutDomainException.UnknownItem 스킴에 없는 코드 (상태 변경 없음)
     */
    public void scan(String itemId) {
        Item item = scheme.getItem(itemId)
                .orElseThrow(() -> new CheckoutDomainException.UnknownItem(itemId));
        lastActivityAt = LocalDateTime.now();

        total = MoneyUtils.addRounded(total, item.getIntrinsicValue());
        log.debug("상품 스캔 - checkoutId: {}, itemId: {}, value: {}, total: {}",
                id, itemId, item.getIntrinsicValue(), total);

        // 어떤 규칙에도 포함되지 않는 상품은 대기 목록에 쌓지 않는다
        if (!scheme.existsInRule(item)) {
            return;
        }

        pendingItems.add(item);
        scheme.getRule(pendingItems).ifPresent(this::apply);
    }

    private void apply(Rule rule) {
        boolean consumed = rule.isMultiItem();
        if (consumed) {
            for (Item required : rule.getRequiredItems()) {
                pendingItems.remove(required);
            }
        }

        total = MoneyUtils.addRounded(total, rule.getAdjustment());

        RuleApplication application = RuleApplication.builder()
                .checkoutId(id)
                .ruleName(rule.getName())
                .adjustment(rule.getAdjustment())
                .itemIds(rule.getRequiredItemIds())
                .consumed(consumed)
                .totalAfter(total)
                .build();
        appliedRules.add(application);
        listener.onRuleApplied(application);
    }

    /**
     * 마지막 스캔(또는 생성) 이후 기준 시각까지 활동이 없었는지 확인
     */
    public boolean isIdleSince(LocalDateTime cutoff) {
        return !lastActivityAt.isAfter(cutoff);
    }

    public BigDecimal getTotal() {
        return total;
    }

    public List<Item> getPendingItems() {
        return Collections.unmodifiableList(new ArrayList<>(pendingItems));
    }

    /**
     * 적용된 규칙 이력 (적용 순서)
     */
    public List<RuleApplication> getAppliedRules() {
        return Collections.unmodifiableList(new ArrayList<>(appliedRules));
    }

    public List<String> getPendingItemIds() {
        return pendingItems.stream().map(Item::getId).toList();
    }
}
