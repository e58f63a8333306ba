package com.yunhwan.amqp.backoff.infra.messaging.rabbit;

import com.yunhwan.amqp.backoff.domain.backoff.DelayQueue;
import com.yunhwan.amqp.backoff.usecase.backoff.port.DelayQueueDeclarer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

/**
 * delay 큐를 필요할 때 선언한다.
 * 동일한 인자의 재선언은 브로커에서 no-op 이므로 매번 선언해도 안전하다.
 * 큐는 x-expires 로 스스로 사라지며 여기서 삭제하지 않는다.
 */
@Slf4j
@Component
public class RabbitDelayQueueDeclarer implements DelayQueueDeclarer {

    private final AmqpAdmin amqpAdmin;
    private final RetryTemplate declareRetryTemplate;

    public RabbitDelayQueueDeclarer(
            AmqpAdmin amqpAdmin,
            @Qualifier("backoffDeclareRetryTemplate") RetryTemplate declareRetryTemplate
    ) {
        this.amqpAdmin = amqpAdmin;
        this.declareRetryTemplate = declareRetryTemplate;
    }

    @Override
    public String exchangeName() {
        return BackoffTopologyConfig.EXCHANGE;
    }

    @Override
    public DelayQueue declare(long delayMs) {
        DelayQueue delayQueue = DelayQueue.forDelay(delayMs);

        declareRetryTemplate.execute(ctx -> {
            if (ctx.getRetryCount() > 0) {
                log.warn("[RabbitDelayQueueDeclarer] retry declare. queue={}, retryCount={}, lastError={}",
                        delayQueue.name(), ctx.getRetryCount(),
                        ctx.getLastThrowable() == null ? null : ctx.getLastThrowable().getMessage());
            }
            amqpAdmin.declareExchange(BackoffTopologyConfig.exchange());
            amqpAdmin.declareQueue(BackoffTopologyConfig.queueOf(delayQueue));
            amqpAdmin.declareBinding(BackoffTopologyConfig.bindingOf(delayQueue));
            return null;
        });

        log.debug("[RabbitDelayQueueDeclarer] declared. queue={}, args={}", delayQueue.name(), delayQueue.queueArguments());
        return delayQueue;
    }
}
