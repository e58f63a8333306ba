package com.yunhwan.amqp.backoff.infra.messaging.rabbit;

import com.yunhwan.amqp.backoff.common.exception.BackoffPublishException;
import com.yunhwan.amqp.backoff.common.exception.UndeliverableMessageException;
import com.yunhwan.amqp.backoff.config.BackoffProperties;
import com.yunhwan.amqp.backoff.domain.backoff.DelayQueue;
import com.yunhwan.amqp.backoff.usecase.backoff.port.BackoffPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.MessagePropertiesBuilder;
import org.springframework.amqp.core.ReturnedMessage;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * delay 큐로 재발행하는 RabbitMQ 구현체.
 * <p>
 * 1. 원본 properties 복제 + backoff 헤더 / expiration 설정 (x-death 는 건드리지 않음)
 * 2. backoff exchange 로 mandatory 발행, routing key = 원래 큐 이름
 * 3. Publisher Confirm(Ack/Nack) 대기
 * 4. Return 확인: Return 은 Ack 보다 먼저 도착하므로 Ack 시점에 없으면 라우팅 성공
 * <p>
 * Return 은 발행마다 새로 만든 CorrelationData 로 연결되므로,
 * 같은 커넥션을 공유하는 다른 republish 호출의 Return 과 섞이지 않는다.
 */
@Slf4j
@Component
public class RabbitBackoffPublisher implements BackoffPublisher {

    private static final String NO_ROUTE = "NO_ROUTE";

    private final RabbitTemplate rabbitTemplate;
    private final long confirmTimeoutMs;

    public RabbitBackoffPublisher(RabbitTemplate rabbitTemplate, BackoffProperties props) {
        this.rabbitTemplate = rabbitTemplate;
        this.confirmTimeoutMs = props.getPublish().getConfirmTimeoutMs();
    }

    @Override
    public void publish(DelayQueue delayQueue, Message original, String targetQueue) {
        CorrelationData cd = new CorrelationData("backoff-" + UUID.randomUUID());
        CompletableFuture<CorrelationData.Confirm> confirmFuture = cd.getFuture();

        Message outgoing = new Message(original.getBody(), outgoingProperties(original, delayQueue.delayMs()));

        try {
            rabbitTemplate.send(delayQueue.exchange(), targetQueue, outgoing, cd);
        } catch (AmqpException e) {
            if (isNoRoute(e)) {
                throw new UndeliverableMessageException(
                        "Channel reported NO_ROUTE. " + e.getMessage(), delayQueue.exchange(), targetQueue, e);
            }
            throw e;
        }

        CorrelationData.Confirm confirm = awaitConfirm(confirmFuture, cd.getId());
        if (!confirm.isAck()) {
            log.warn("[RabbitBackoffPublisher] Broker NACK. correlationId={}, queue={}, reason={}",
                    cd.getId(), delayQueue.name(), confirm.getReason());
            throw new BackoffPublishException("Broker NACK. reason=" + confirm.getReason());
        }

        ReturnedMessage returned = cd.getReturned();
        if (returned != null) {
            log.warn("[RabbitBackoffPublisher] Message RETURNED. correlationId={}, replyCode={}, replyText={}, exchange={}, routingKey={}",
                    cd.getId(), returned.getReplyCode(), returned.getReplyText(),
                    returned.getExchange(), returned.getRoutingKey());
            throw new UndeliverableMessageException(
                    returned.getReplyCode(), returned.getReplyText(), returned.getExchange(), returned.getRoutingKey());
        }

        log.debug("[RabbitBackoffPublisher] confirmed. correlationId={}, queue={}, targetQueue={}",
                cd.getId(), delayQueue.name(), targetQueue);
    }

    static MessageProperties outgoingProperties(Message original, long delayMs) {
        MessageProperties source = original.getMessageProperties();
        MessageProperties props = MessagePropertiesBuilder.fromClonedProperties(source)
                .setHeader(DelayQueue.BACKOFF_HEADER, delayMs)
                .setExpiration(Long.toString(delayMs))
                .build();

        // 수신 메시지는 deliveryMode 대신 receivedDeliveryMode 만 채워져 있음
        if (props.getDeliveryMode() == null && source.getReceivedDeliveryMode() != null) {
            props.setDeliveryMode(source.getReceivedDeliveryMode());
        }
        return props;
    }

    private CorrelationData.Confirm awaitConfirm(CompletableFuture<CorrelationData.Confirm> future, String correlationId) {
        try {
            return future.get(confirmTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.error("[RabbitBackoffPublisher] Confirm timeout. correlationId={}, timeoutMs={}", correlationId, confirmTimeoutMs);
            throw new BackoffPublishException("Confirm timeout. correlationId=" + correlationId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackoffPublishException("Interrupted while waiting for confirm. correlationId=" + correlationId, e);
        } catch (ExecutionException e) {
            throw new BackoffPublishException("Confirm failed. correlationId=" + correlationId, e.getCause());
        }
    }

    private static boolean isNoRoute(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg != null && msg.contains(NO_ROUTE)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
