package com.teambind.checkout.application.port.out;

/**
 * 체크아웃 세션 삭제 포트
 */
public interface RemoveCheckoutPort {

    /**
     * @return 삭제된 세션이 있었는지 여부
     */
    boolean remove(Long checkoutId);
}
