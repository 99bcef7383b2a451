package com.teambind.checkout.adapter.out.scheme;

import com.teambind.checkout.domain.exception.CheckoutDomainException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * 스킴 금액 계산식 평가기
 * 숫자 리터럴과 + - * / ( ) 만 허용하며 SpEL 읽기 전용 컨텍스트에서 평가한다.
 * 정수 리터럴은 실수로 바꿔 정수 나눗셈을 피한다.
 */
@Component
public class ArithmeticExpressionEvaluator {

    private static final Pattern ALLOWED = Pattern.compile("[0-9.+\\-*/()\\s]+");
    private static final Pattern LEADING_DOT = Pattern.compile("(?<!\\d)\\.(\\d)");
    private static final Pattern INTEGER_LITERAL = Pattern.compile("(?<![\\d.])(\\d+)(?![\\d.])");

    private final ExpressionParser parser = new SpelExpressionParser();
    private final EvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding().build();

    /**
     * @param expression 상품 토큰이 치환된 계산식
     * @return 계산 결과
     * @throws CheckoutDomainException.MalformedSchemeEntry 허용되지 않는 문자, 문법 오류, 0으로 나누기
     */
    public BigDecimal evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new CheckoutDomainException.MalformedSchemeEntry("계산식이 비어 있습니다");
        }
        if (!ALLOWED.matcher(expression).matches()) {
            throw new CheckoutDomainException.MalformedSchemeEntry("허용되지 않는 문자가 포함된 계산식입니다: " + expression.strip());
        }

        String normalized = LEADING_DOT.matcher(expression).replaceAll("0.$1");
        normalized = INTEGER_LITERAL.matcher(normalized).replaceAll("$1.0");

        Object value;
        try {
            value = parser.parseExpression(normalized).getValue(context);
        } catch (ParseException | EvaluationException e) {
            throw new CheckoutDomainException.MalformedSchemeEntry(
                    "계산식을 평가할 수 없습니다: " + expression.strip(), e);
        }

        if (!(value instanceof Number)) {
            throw new CheckoutDomainException.MalformedSchemeEntry("계산 결과가 숫자가 아닙니다: " + expression.strip());
        }
        double result = ((Number) value).doubleValue();
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new CheckoutDomainException.MalformedSchemeEntry("계산 결과가 유한하지 않습니다: " + expression.strip());
        }
        return BigDecimal.valueOf(result);
    }
}
