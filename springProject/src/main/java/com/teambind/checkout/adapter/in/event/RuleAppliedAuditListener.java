package com.teambind.checkout.adapter.in.event;

import com.teambind.checkout.adapter.out.event.RuleAppliedEvent;
import com.teambind.checkout.domain.model.RuleApplication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 규칙 적용 감사 로그
 */
@Slf4j
@Component
public class RuleAppliedAuditListener {

    @EventListener
    public void onRuleApplied(RuleAppliedEvent event) {
        RuleApplication application = event.getApplication();
        log.info("조정 규칙 적용 - checkoutId: {}, rule: {}, adjustment: {}, items: {}, consumed: {}, total: {}",
                application.getCheckoutId(), application.getRuleName(), application.getAdjustment(),
                application.getItemIds(), application.isConsumed(), application.getTotalAfter());
    }
}
