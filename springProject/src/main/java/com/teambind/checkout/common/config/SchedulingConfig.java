package com.teambind.checkout.common.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 세션 만료 스케줄러 활성화
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
}
