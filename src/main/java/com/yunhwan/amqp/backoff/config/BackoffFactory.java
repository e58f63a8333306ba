package com.yunhwan.amqp.backoff.config;

import com.yunhwan.amqp.backoff.domain.backoff.Backoff;
import com.yunhwan.amqp.backoff.domain.backoff.RetryPolicy;
import org.springframework.stereotype.Component;

/**
 * 설정된 정책으로 실패 하나당 {@link Backoff} 를 만든다.
 */
@Component
public class BackoffFactory {

    private final RetryPolicy policy;

    public BackoffFactory(BackoffProperties props) {
        this.policy = props.toPolicy();
    }

    public Backoff create(Throwable cause) {
        return new Backoff(policy, cause);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
