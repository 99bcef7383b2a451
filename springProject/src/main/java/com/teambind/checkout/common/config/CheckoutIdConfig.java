package com.teambind.checkout.common.config;

import com.teambind.checkout.common.util.CheckoutIdGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 체크아웃 세션 ID 생성기 설정
 */
@Configuration
public class CheckoutIdConfig {

    @Value("${checkout.id.worker-id:1}")
    private long workerId;

    @Value("${checkout.id.datacenter-id:1}")
    private long datacenterId;

    @Bean
    public CheckoutIdGenerator checkoutIdGenerator() {
        return new CheckoutIdGenerator(workerId, datacenterId);
    }
}
