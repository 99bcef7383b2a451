package com.teambind.checkout.application.port.out;

import com.teambind.checkout.domain.model.Scheme;

/**
 * 가격 스킴 로딩 포트
 */
public interface LoadSchemePort {

    Scheme loadScheme();
}
