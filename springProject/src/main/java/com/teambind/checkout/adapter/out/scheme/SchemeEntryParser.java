package com.teambind.checkout.adapter.out.scheme;

import com.teambind.checkout.domain.exception.CheckoutDomainException;
import com.teambind.checkout.domain.model.Coupon;
import com.teambind.checkout.domain.model.Item;
import com.teambind.checkout.domain.model.ItemKind;
import com.teambind.checkout.domain.model.Product;
import com.teambind.checkout.domain.model.Rule;
import com.teambind.checkout.domain.model.Scheme;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 스킴 정의 파서
 *
 * 형식: {KEY} -> VALUE
 * - VALUE 에 '=' 가 없으면 상품 정의: {id} -> 가격 (id 가 'C' 로 시작하면 쿠폰, 값은 할인율)
 * - VALUE 에 '=' 가 있으면 규칙 정의: {name} -> {id}{id}...=계산식
 * - 빈 줄과 '#' 으로 시작하는 줄은 무시
 *
 * 잘못된 라인은 진단과 함께 건너뛰고 나머지 라인을 계속 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemeEntryParser {

    private static final String SEPARATOR = "->";
    private static final Pattern BRACE_GROUP = Pattern.compile("\\{([^{}]+)}");

    private final ArithmeticExpressionEvaluator expressionEvaluator;

    public SchemeParseResult parse(List<String> lines) {
        Scheme.Builder builder = Scheme.builder();
        List<SchemeParseResult.SkippedEntry> skipped = new ArrayList<>();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            try {
                parseLine(builder, line);
            } catch (CheckoutDomainException e) {
                log.warn("스킴 라인 건너뜀 - line: {}, code: {}, error: {}", i + 1, e.getCode(), e.getMessage());
                skipped.add(new SchemeParseResult.SkippedEntry(i + 1, line, e.getCode(), e.getMessage()));
            }
        }

        return SchemeParseResult.builder()
                .scheme(builder.build())
                .skippedEntries(List.copyOf(skipped))
                .build();
    }

    void parseLine(Scheme.Builder builder, String line) {
        int separator = line.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new CheckoutDomainException.MalformedSchemeEntry("'->' 구분자가 없습니다: " + line);
        }
        if (line.indexOf(SEPARATOR, separator + SEPARATOR.length()) >= 0) {
            throw new CheckoutDomainException.MalformedSchemeEntry("'->' 구분자가 두 번 이상 있습니다: " + line);
        }

        String key = line.substring(0, separator).strip();
        String value = line.substring(separator + SEPARATOR.length()).strip();
        String name = extractKey(key);

        if (value.contains("=")) {
            parseRule(builder, name, value);
        } else {
            parseItem(builder, name, value);
        }
    }

    private String extractKey(String key) {
        Matcher matcher = BRACE_GROUP.matcher(key);
        if (!matcher.find()) {
            throw new CheckoutDomainException.MalformedSchemeEntry("키에 {..} 그룹이 없습니다: " + key);
        }
        return matcher.group(1).strip();
    }

    private void parseItem(Scheme.Builder builder, String itemId, String value) {
        BigDecimal amount = expressionEvaluator.evaluate(value);

        Item item;
        if (ItemKind.fromItemId(itemId) == ItemKind.COUPON) {
            if (amount.compareTo(BigDecimal.ZERO) < 0 || amount.compareTo(BigDecimal.ONE) > 0) {
                throw new CheckoutDomainException.DefinitionError(
                        "쿠폰 할인율은 0 과 1 사이여야 합니다: " + itemId + " = " + amount);
            }
            item = new Coupon(itemId, amount);
        } else {
            item = new Product(itemId, amount);
        }

        builder.item(item);
        log.debug("상품 정의 - itemId: {}, kind: {}, value: {}", itemId, item.getKind(), amount);
    }

    private void parseRule(Scheme.Builder builder, String name, String value) {
        int equals = value.indexOf('=');
        if (value.indexOf('=', equals + 1) >= 0) {
            throw new CheckoutDomainException.MalformedSchemeEntry("규칙에 '=' 가 두 번 이상 있습니다: " + name);
        }

        String itemsPart = value.substring(0, equals);
        String expression = value.substring(equals + 1);

        if (!BRACE_GROUP.matcher(itemsPart).replaceAll("").isBlank()) {
            throw new CheckoutDomainException.MalformedSchemeEntry("규칙 상품 목록은 {id} 토큰만 허용됩니다: " + itemsPart.strip());
        }

        List<Item> requiredItems = new ArrayList<>();
        Matcher matcher = BRACE_GROUP.matcher(itemsPart);
        while (matcher.find()) {
            requiredItems.add(resolve(builder, matcher.group(1)));
        }

        BigDecimal targetAmount = expressionEvaluator.evaluate(substituteItemValues(builder, expression));
        Rule rule = new Rule(name, requiredItems, targetAmount);
        builder.rule(rule);

        log.debug("규칙 정의 - name: {}, items: {}, target: {}, adjustment: {}",
                name, rule.getRequiredItemIds(), targetAmount, rule.getAdjustment());
    }

    /**
     * 계산식의 {id} 토큰을 상품의 명목 값으로 치환
     */
    private String substituteItemValues(Scheme.Builder builder, String expression) {
        Matcher matcher = BRACE_GROUP.matcher(expression);
        StringBuilder substituted = new StringBuilder();
        while (matcher.find()) {
            Item item = resolve(builder, matcher.group(1));
            String replacement = "(" + item.getNominalValue().toPlainString() + ")";
            matcher.appendReplacement(substituted, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(substituted);
        return substituted.toString();
    }

    private Item resolve(Scheme.Builder builder, String itemId) {
        String id = itemId.strip();
        return builder.findItem(id)
                .orElseThrow(() -> new CheckoutDomainException.UnknownItem(id));
    }
}
