package com.teambind.checkout.application.service;

import com.teambind.checkout.application.port.in.ExpireIdleCheckoutsUseCase;
import com.teambind.checkout.application.port.out.LoadCheckoutPort;
import com.teambind.checkout.application.port.out.RemoveCheckoutPort;
import com.teambind.checkout.domain.model.Checkout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 유휴 체크아웃 만료 서비스
 * 마지막 스캔 후 일정 시간이 지난 세션을 저장소에서 제거한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutExpirationService implements ExpireIdleCheckoutsUseCase {

    private final LoadCheckoutPort loadCheckoutPort;
    private final RemoveCheckoutPort removeCheckoutPort;

    @Value("${checkout.session.idle-timeout-minutes:30}")
    private long idleTimeoutMinutes;

    @Scheduled(fixedDelay = 60000, initialDelay = 60000)
    public void scheduledExpiration() {
        expireIdleCheckouts();
    }

    @Override
    public int expireIdleCheckouts() {
        LocalDateTime cutoff = LocalDateTime.now().minusMinutes(idleTimeoutMinutes);
        List<Checkout> idleCheckouts = loadCheckoutPort.loadIdleSince(cutoff);

        if (idleCheckouts.isEmpty()) {
            log.debug("만료 대상 체크아웃 세션이 없습니다");
            return 0;
        }

        int expired = 0;
        for (Checkout checkout : idleCheckouts) {
            synchronized (checkout) {
                // 조회 이후 스캔이 들어온 세션은 유지
                if (checkout.isIdleSince(cutoff) && removeCheckoutPort.remove(checkout.getId())) {
                    expired++;
                    log.debug("체크아웃 세션 만료 - checkoutId: {}, lastActivityAt: {}",
                            checkout.getId(), checkout.getLastActivityAt());
                }
            }
        }

        log.info("유휴 체크아웃 세션 만료 완료 - expired: {}/{}, timeout: {}분",
                expired, idleCheckouts.size(), idleTimeoutMinutes);
        return expired;
    }
}
