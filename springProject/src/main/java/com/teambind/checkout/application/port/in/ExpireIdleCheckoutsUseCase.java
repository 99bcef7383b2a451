package com.teambind.checkout.application.port.in;

/**
 * 유휴 체크아웃 만료 UseCase
 */
public interface ExpireIdleCheckoutsUseCase {

    /**
     * 설정된 시간 동안 스캔이 없던 세션을 삭제
     *
     * @return 만료된 세션 수
     */
    int expireIdleCheckouts();
}
