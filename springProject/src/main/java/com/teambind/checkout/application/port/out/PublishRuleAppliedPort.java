package com.teambind.checkout.application.port.out;

import com.teambind.checkout.domain.model.RuleApplication;

/**
 * 규칙 적용 이벤트 발행 포트
 */
public interface PublishRuleAppliedPort {

    void publish(RuleApplication application);
}
