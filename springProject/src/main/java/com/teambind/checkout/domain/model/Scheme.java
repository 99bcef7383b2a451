package com.teambind.checkout.domain.model;

import com.teambind.checkout.domain.exception.CheckoutDomainException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 가격 스킴 (Aggregate Root)
 * 상품과 규칙의 카탈로그이며 생성 이후 변경되지 않는다.
 * 여러 체크아웃 세션이 읽기 전용으로 공유할 수 있다.
 */
@Slf4j
public final class Scheme {

    private final Map<String, Item> itemsById;
    private final List<Rule> rules;

    private Scheme(Map<String, Item> itemsById, List<Rule> rules) {
        this.itemsById = Collections.unmodifiableMap(new LinkedHashMap<>(itemsById));
        this.rules = List.copyOf(rules);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Item> getItem(String itemId) {
        return Optional.ofNullable(itemsById.get(itemId));
    }

    public Optional<Rule> getRuleByName(String name) {
        return rules.stream().filter(rule -> rule.getName().equals(name)).findFirst();
    }

    /**
     * 상품이 하나 이상의 규칙에 포함되는지 확인
     */
    public boolean existsInRule(Item item) {
        return rules.stream().anyMatch(rule -> rule.requires(item));
    }

    /**
     * 대기 목록에 적용할 규칙 선택
     *
     * 1. 마지막으로 추가된 상품을 포함하는 규칙만 후보가 된다.
     * 2. 규칙의 요구 다중집합이 대기 다중집합의 부분집합이어야 한다.
     * 3. 남는 대기 단위 수가 가장 적은 규칙이 선택되며, 동률이면 먼저 선언된 규칙이 선택된다.
     *
     * @param pendingItems 스캔 순서대로의 대기 상품
     * @return 적용할 규칙
     */
    public Optional<Rule> getRule(List<? extends Item> pendingItems) {
        if (pendingItems.isEmpty()) {
            return Optional.empty();
        }

        Item latest = pendingItems.get(pendingItems.size() - 1);
        ItemMultiset pending = ItemMultiset.of(pendingItems);

        Rule best = null;
        int bestLeftover = Integer.MAX_VALUE;
        for (Rule rule : rules) {
            if (!rule.requires(latest) || !rule.matches(pending)) {
                continue;
            }
            int leftover = rule.leftoverAgainst(pending);
            log.debug("규칙 후보 - rule: {}, leftover: {}", rule.getName(), leftover);
            // 동률은 선언 순서 우선
            if (leftover < bestLeftover) {
                best = rule;
                bestLeftover = leftover;
            }
        }
        return Optional.ofNullable(best);
    }

    public Collection<Item> getItems() {
        return itemsById.values();
    }

    public List<Rule> getRules() {
        return rules;
    }

    /**
     * 스킴 생성기
     * 규칙이 참조하는 상품은 규칙보다 먼저 등록되어 있어야 한다.
     */
    public static final class Builder {

        private final Map<String, Item> itemsById = new LinkedHashMap<>();
        private final List<Rule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder item(Item item) {
            if (itemsById.containsKey(item.getId())) {
                throw new CheckoutDomainException.DefinitionError("중복된 상품 ID입니다: " + item.getId());
            }
            itemsById.put(item.getId(), item);
            return this;
        }

        public Builder rule(Rule rule) {
            boolean duplicated = rules.stream().anyMatch(r -> r.getName().equals(rule.getName()));
            if (duplicated) {
                throw new CheckoutDomainException.DefinitionError("중복된 규칙 이름입니다: " + rule.getName());
            }
            for (Item required : rule.getRequiredItems()) {
                if (!itemsById.containsKey(required.getId())) {
                    throw new CheckoutDomainException.UnknownItem(required.getId());
                }
            }
            rules.add(rule);
            return this;
        }

        public Optional<Item> findItem(String itemId) {
            return Optional.ofNullable(itemsById.get(itemId));
        }

        public Scheme build() {
            return new Scheme(itemsById, rules);
        }
    }
}
