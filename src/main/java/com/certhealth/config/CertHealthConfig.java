package com.certhealth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 엔진 공통 빈 구성입니다.
 */
@Configuration
public class CertHealthConfig {

    /** 프로브/분류/스케줄러가 공유하는 시계. 테스트에서는 고정 시계로 교체합니다. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
