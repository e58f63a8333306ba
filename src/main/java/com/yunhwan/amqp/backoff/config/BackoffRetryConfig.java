package com.yunhwan.amqp.backoff.config;

import com.yunhwan.amqp.backoff.common.exception.UndeliverableMessageException;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpResourceNotAvailableException;
import org.springframework.amqp.AmqpTimeoutException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;

/**
 * 호출 지점별 재시도 정책.
 * - publish : Return / NO_ROUTE (UndeliverableMessageException) 만 재시도
 * - declare : 커넥션/타임아웃/채널 부족 같은 일시 장애만 재시도
 */
@Configuration
public class BackoffRetryConfig {

    @Bean
    public RetryTemplate backoffPublishRetryTemplate(BackoffProperties props) {
        return publishRetryTemplate(props.getPublish());
    }

    @Bean
    public RetryTemplate backoffDeclareRetryTemplate(BackoffProperties props) {
        return declareRetryTemplate(props.getDeclare());
    }

    public static RetryTemplate publishRetryTemplate(BackoffProperties.Publish publish) {
        return withBackoff(RetryTemplate.builder(), publish.getBackoffMs())
                .maxAttempts(publish.getMaxAttempts())
                .retryOn(UndeliverableMessageException.class)
                .build();
    }

    public static RetryTemplate declareRetryTemplate(BackoffProperties.Declare declare) {
        return withBackoff(RetryTemplate.builder(), declare.getBackoffMs())
                .maxAttempts(declare.getMaxAttempts())
                .retryOn(AmqpConnectException.class)
                .retryOn(AmqpTimeoutException.class)
                .retryOn(AmqpResourceNotAvailableException.class)
                .build();
    }

    private static RetryTemplateBuilder withBackoff(RetryTemplateBuilder builder, long backoffMs) {
        // fixedBackoff 는 1ms 이상만 허용
        return backoffMs > 0 ? builder.fixedBackoff(backoffMs) : builder.noBackoff();
    }
}
