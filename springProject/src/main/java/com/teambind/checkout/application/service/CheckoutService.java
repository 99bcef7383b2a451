package com.teambind.checkout.application.service;

import com.teambind.checkout.application.port.in.CheckoutView;
import com.teambind.checkout.application.port.in.CloseCheckoutUseCase;
import com.teambind.checkout.application.port.in.GetCheckoutUseCase;
import com.teambind.checkout.application.port.in.OpenCheckoutUseCase;
import com.teambind.checkout.application.port.in.ScanItemCommand;
import com.teambind.checkout.application.port.in.ScanItemUseCase;
import com.teambind.checkout.application.port.out.LoadCheckoutPort;
import com.teambind.checkout.application.port.out.LoadSchemePort;
import com.teambind.checkout.application.port.out.PublishRuleAppliedPort;
import com.teambind.checkout.application.port.out.RemoveCheckoutPort;
import com.teambind.checkout.application.port.out.SaveCheckoutPort;
import com.teambind.checkout.common.util.CheckoutIdGenerator;
import com.teambind.checkout.domain.exception.CheckoutDomainException;
import com.teambind.checkout.domain.model.Checkout;
import com.teambind.checkout.domain.model.RuleApplication;
import com.teambind.checkout.domain.model.Scheme;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * 체크아웃 서비스
 * 세션 생성, 상품 스캔, 합계 조회, 세션 종료 처리
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutService implements OpenCheckoutUseCase, ScanItemUseCase, GetCheckoutUseCase, CloseCheckoutUseCase {

    private final LoadSchemePort loadSchemePort;
    private final SaveCheckoutPort saveCheckoutPort;
    private final LoadCheckoutPort loadCheckoutPort;
    private final RemoveCheckoutPort removeCheckoutPort;
    private final PublishRuleAppliedPort publishRuleAppliedPort;
    private final CheckoutIdGenerator checkoutIdGenerator;

    @Override
    public CheckoutView openCheckout() {
        Scheme scheme = loadSchemePort.loadScheme();
        Checkout checkout = new Checkout(checkoutIdGenerator.nextId(), scheme, publishRuleAppliedPort::publish);
        saveCheckoutPort.save(checkout);

        log.info("체크아웃 세션 시작 - checkoutId: {}, items: {}, rules: {}",
                checkout.getId(), scheme.getItems().size(), scheme.getRules().size());

        return CheckoutView.from(checkout);
    }

    /**
     * 상품 스캔
     * 스킴에 없는 상품은 실패 결과로 처리하고 다음 스캔을 계속 받는다.
     */
    @Override
    public ScanResult scan(ScanItemCommand command) {
        Checkout checkout = findCheckout(command.getCheckoutId());

        // 같은 세션에 대한 스캔은 도착 순서대로 직렬화
        synchronized (checkout) {
            log.info("상품 스캔 - checkoutId: {}, itemId: {}", checkout.getId(), command.getItemId());

            BigDecimal before = checkout.getTotal();
            int appliedBefore = checkout.getAppliedRules().size();

            try {
                checkout.scan(command.getItemId());
            } catch (CheckoutDomainException.UnknownItem e) {
                log.warn("상품 스캔 실패 - checkoutId: {}, itemId: {}, error: {}",
                        checkout.getId(), command.getItemId(), e.getMessage());
                return ScanResult.builder()
                        .checkoutId(checkout.getId())
                        .itemId(command.getItemId())
                        .success(false)
                        .total(checkout.getTotal())
                        .message(e.getMessage())
                        .build();
            }

            List<RuleApplication> applied = checkout.getAppliedRules();
            RuleApplication application = applied.size() > appliedBefore
                    ? applied.get(applied.size() - 1)
                    : null;
            BigDecimal scannedValue = checkout.getScheme().getItem(command.getItemId())
                    .map(item -> item.getIntrinsicValue())
                    .orElse(BigDecimal.ZERO);

            log.debug("상품 스캔 완료 - checkoutId: {}, before: {}, after: {}",
                    checkout.getId(), before, checkout.getTotal());

            return ScanResult.builder()
                    .checkoutId(checkout.getId())
                    .itemId(command.getItemId())
                    .success(true)
                    .scannedValue(scannedValue)
                    .appliedRule(application != null ? application.getRuleName() : null)
                    .adjustment(application != null ? application.getAdjustment() : null)
                    .total(checkout.getTotal())
                    .message(application != null ? "규칙 " + application.getRuleName() + " 적용" : "스캔 완료")
                    .build();
        }
    }

    @Override
    public CheckoutView getCheckout(Long checkoutId) {
        Checkout checkout = findCheckout(checkoutId);
        synchronized (checkout) {
            return CheckoutView.from(checkout);
        }
    }

    @Override
    public CheckoutView closeCheckout(Long checkoutId) {
        Checkout checkout = findCheckout(checkoutId);
        synchronized (checkout) {
            if (!removeCheckoutPort.remove(checkoutId)) {
                throw new CheckoutDomainException.CheckoutNotFound(checkoutId);
            }
            log.info("체크아웃 세션 종료 - checkoutId: {}, total: {}, rulesApplied: {}",
                    checkoutId, checkout.getTotal(), checkout.getAppliedRules().size());
            return CheckoutView.from(checkout);
        }
    }

    private Checkout findCheckout(Long checkoutId) {
        return loadCheckoutPort.loadById(checkoutId)
                .orElseThrow(() -> new CheckoutDomainException.CheckoutNotFound(checkoutId));
    }
}
