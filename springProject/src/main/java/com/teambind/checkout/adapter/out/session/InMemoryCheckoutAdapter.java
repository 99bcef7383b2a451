package com.teambind.checkout.adapter.out.session;

import com.teambind.checkout.application.port.out.LoadCheckoutPort;
import com.teambind.checkout.application.port.out.RemoveCheckoutPort;
import com.teambind.checkout.application.port.out.SaveCheckoutPort;
import com.teambind.checkout.domain.model.Checkout;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 메모리 기반 체크아웃 세션 저장소
 * 프로세스 재시작 시 세션은 유지되지 않는다. 종료 또는 만료된 세션은 제거된다.
 */
@Slf4j
@Component
public class InMemoryCheckoutAdapter implements SaveCheckoutPort, LoadCheckoutPort, RemoveCheckoutPort {

    private final Map<Long, Checkout> sessions = new ConcurrentHashMap<>();

    @Override
    public Checkout save(Checkout checkout) {
        sessions.put(checkout.getId(), checkout);
        log.debug("체크아웃 세션 저장 - checkoutId: {}, sessions: {}", checkout.getId(), sessions.size());
        return checkout;
    }

    @Override
    public Optional<Checkout> loadById(Long checkoutId) {
        if (checkoutId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(checkoutId));
    }

    @Override
    public List<Checkout> loadIdleSince(LocalDateTime cutoff) {
        return sessions.values().stream()
                .filter(checkout -> checkout.isIdleSince(cutoff))
                .toList();
    }

    @Override
    public boolean remove(Long checkoutId) {
        if (checkoutId == null) {
            return false;
        }
        boolean removed = sessions.remove(checkoutId) != null;
        log.debug("체크아웃 세션 삭제 - checkoutId: {}, removed: {}, sessions: {}", checkoutId, removed, sessions.size());
        return removed;
    }
}
