package com.teambind.checkout.adapter.out.event;

import com.teambind.checkout.domain.model.RuleApplication;
import lombok.Value;

import java.time.Instant;

/**
 * 규칙 적용 애플리케이션 이벤트
 */
@Value
public class RuleAppliedEvent {
    RuleApplication application;
    Instant occurredAt;

    public static RuleAppliedEvent of(RuleApplication application) {
        return new RuleAppliedEvent(application, Instant.now());
    }
}
