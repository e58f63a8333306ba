package com.yunhwan.amqp.backoff.infra.messaging.rabbit;

import com.yunhwan.amqp.backoff.domain.backoff.DelayQueue;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.HeadersExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;

/**
 * backoff 토폴로지.
 * <p>
 * exchange 하나(headers, "backoff")를 모든 delay 에 공유하고,
 * delay 큐는 런타임에 필요한 delay 값마다 {@link #queueOf}/{@link #bindingOf} 로 만들어 선언한다.
 */
@Configuration
public class BackoffTopologyConfig {

    public static final String EXCHANGE = DelayQueue.EXCHANGE;

    @Bean
    public HeadersExchange backoffExchange() {
        return exchange();
    }

    public static HeadersExchange exchange() {
        return new HeadersExchange(EXCHANGE, true, false);
    }

    public static Queue queueOf(DelayQueue delayQueue) {
        return QueueBuilder.durable(delayQueue.name())
                .withArguments(delayQueue.queueArguments())
                .build();
    }

    // x-match=any : backoff 헤더 값만 맞으면 다른 헤더와 무관하게 라우팅
    public static Binding bindingOf(DelayQueue delayQueue) {
        return new Binding(
                delayQueue.name(),
                Binding.DestinationType.QUEUE,
                delayQueue.exchange(),
                "",
                new HashMap<>(delayQueue.bindingArguments())
        );
    }
}
