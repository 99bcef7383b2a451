package com.teambind.checkout.domain.model;

/**
 * 규칙 적용 알림 수신자
 */
@FunctionalInterface
public interface RuleAppliedListener {

    RuleAppliedListener NONE = application -> { };

    void onRuleApplied(RuleApplication application);
}
