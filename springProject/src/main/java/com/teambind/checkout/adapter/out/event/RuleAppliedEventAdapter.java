package com.teambind.checkout.adapter.out.event;

import com.teambind.checkout.application.port.out.PublishRuleAppliedPort;
import com.teambind.checkout.domain.model.RuleApplication;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * 규칙 적용 이벤트 발행 어댑터
 * Spring 애플리케이션 이벤트로 동기 발행한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleAppliedEventAdapter implements PublishRuleAppliedPort {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void publish(RuleApplication application) {
        log.debug("규칙 적용 이벤트 발행 - checkoutId: {}, rule: {}",
                application.getCheckoutId(), application.getRuleName());
        eventPublisher.publishEvent(RuleAppliedEvent.of(application));
    }
}
