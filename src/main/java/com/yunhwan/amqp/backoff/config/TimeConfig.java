package com.yunhwan.amqp.backoff.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    // 이벤트 로그 occurred_at 기준 시계
    @Bean
    public Clock eventClock() {
        return Clock.systemUTC();
    }
}
