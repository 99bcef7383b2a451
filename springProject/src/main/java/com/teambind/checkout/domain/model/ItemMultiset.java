package com.teambind.checkout.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 상품 ID 기준 다중집합 (ID -> 개수)
 * 최초 등장 순서를 유지한다.
 */
public final class ItemMultiset {

    private final Map<String, Integer> counts = new LinkedHashMap<>();

    public static ItemMultiset of(Collection<? extends Item> items) {
        ItemMultiset multiset = new ItemMultiset();
        items.forEach(multiset::add);
        return multiset;
    }

    public static ItemMultiset ofIds(String... itemIds) {
        ItemMultiset multiset = new ItemMultiset();
        for (String itemId : itemIds) {
            multiset.add(itemId);
        }
        return multiset;
    }

    public void add(Item item) {
        add(item.getId());
    }

    public void add(String itemId) {
        counts.merge(itemId, 1, Integer::sum);
    }

    /**
     * 한 단위 제거
     * @return 제거 여부
     */
    public boolean remove(String itemId) {
        Integer current = counts.get(itemId);
        if (current == null) {
            return false;
        }
        if (current == 1) {
            counts.remove(itemId);
        } else {
            counts.put(itemId, current - 1);
        }
        return true;
    }

    public int count(String itemId) {
        return counts.getOrDefault(itemId, 0);
    }

    public boolean contains(String itemId) {
        return counts.containsKey(itemId);
    }

    public Set<String> distinctIds() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    public int size() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * 모든 ID에 대해 this 의 개수가 other 의 개수 이하인지 확인
     */
    public boolean isSubMultisetOf(ItemMultiset other) {
        return counts.entrySet().stream()
                .allMatch(entry -> other.count(entry.getKey()) >= entry.getValue());
    }

    /**
     * other 를 빼고 남는 단위 수의 합
     * sum(max(0, this[id] - other[id]))
     */
    public int differenceSum(ItemMultiset other) {
        return counts.entrySet().stream()
                .mapToInt(entry -> Math.max(0, entry.getValue() - other.count(entry.getKey())))
                .sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ItemMultiset)) {
            return false;
        }
        return counts.equals(((ItemMultiset) o).counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
