package com.yunhwan.amqp.backoff.usecase.backoff;

import com.yunhwan.amqp.backoff.common.exception.UndeliverableMessageException;
import com.yunhwan.amqp.backoff.domain.backoff.Backoff;
import com.yunhwan.amqp.backoff.domain.backoff.BackoffAttempt;
import com.yunhwan.amqp.backoff.domain.backoff.BackoffDecision;
import com.yunhwan.amqp.backoff.domain.backoff.DelayQueue;
import com.yunhwan.amqp.backoff.domain.backoff.DeliveryHistory;
import com.yunhwan.amqp.backoff.infra.logging.BackoffEventLogger;
import com.yunhwan.amqp.backoff.infra.metrics.MetricsConfig;
import com.yunhwan.amqp.backoff.usecase.backoff.port.BackoffPublisher;
import com.yunhwan.amqp.backoff.usecase.backoff.port.DelayQueueDeclarer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * BackoffRouter
 * <p>
 * 계산된 대기 시간을 브로커 토폴로지로 옮기고 메시지를 재발행한다.
 * <ol>
 *   <li>x-death 이력으로 다음 delay 계산 (EXPIRED 면 선언/발행 없이 종료)</li>
 *   <li>delay 큐 선언 (backoff--{delay}ms)</li>
 *   <li>backoff exchange 로 mandatory 발행 + confirm 대기</li>
 *   <li>라우팅 실패(Return / NO_ROUTE)는 제한 횟수만큼 재시도, 재시도 전에 토폴로지 재선언</li>
 * </ol>
 * 내부 스레드 없음. 호출 스레드에서 동기 실행된다.
 */
@Slf4j
@Service
public class BackoffRouter {

    private final DelayQueueDeclarer declarer;
    private final BackoffPublisher publisher;
    private final RetryTemplate publishRetryTemplate;
    private final BackoffEventLogger eventLogger;
    private final MeterRegistry meterRegistry;

    public BackoffRouter(
            DelayQueueDeclarer declarer,
            BackoffPublisher publisher,
            @Qualifier("backoffPublishRetryTemplate") RetryTemplate publishRetryTemplate,
            BackoffEventLogger eventLogger,
            MeterRegistry meterRegistry
    ) {
        this.declarer = declarer;
        this.publisher = publisher;
        this.publishRetryTemplate = publishRetryTemplate;
        this.eventLogger = eventLogger;
        this.meterRegistry = meterRegistry;
    }

    public DelayQueue queueFor(long delayMs) {
        return DelayQueue.forDelay(delayMs);
    }

    public RepublishResult republish(Backoff backoff, Message message, String targetQueue) {
        if (targetQueue == null || targetQueue.isBlank()) {
            throw new IllegalArgumentException("targetQueue must not be blank");
        }

        // 1) delay 계산
        DeliveryHistory history = DeliveryHistory.fromHeaders(message.getMessageProperties().getHeaders());
        BackoffDecision decision = backoff.next(history, declarer.exchangeName());

        if (decision.isExpired()) {
            log.warn("[BackoffRouter] EXPIRED -> give up. targetQueue={}, attempts={}, reason={}",
                    targetQueue, decision.expired().getTotalAttempts(), decision.expired().getMessage());
            republishCounter(MetricsConfig.RESULT_EXPIRED).increment();
            eventLogger.expired(targetQueue, decision.expired());
            return RepublishResult.ofExpired(decision.expired());
        }

        BackoffAttempt attempt = decision.attempt();

        // 2) delay 큐 선언
        DelayQueue delayQueue = declarer.declare(attempt.nextExpirationMs());

        // 3) 발행 (+ 라우팅 실패 시 재시도)
        try {
            publishRetryTemplate.execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.info("[BackoffRouter] redeclare before retry. queue={}, retryCount={}",
                            delayQueue.name(), ctx.getRetryCount());
                    declarer.declare(delayQueue.delayMs());
                }
                publishOnce(delayQueue, message, targetQueue);
                return null;
            });
        } catch (UndeliverableMessageException e) {
            log.error("[BackoffRouter] UNDELIVERABLE after retries. queue={}, targetQueue={}, err={}",
                    delayQueue.name(), targetQueue, e.getMessage());
            republishCounter(MetricsConfig.RESULT_UNDELIVERABLE).increment();
            eventLogger.undeliverable(targetQueue, delayQueue, attempt, e);
            return RepublishResult.ofUndeliverable(attempt, delayQueue.name(), e);
        }

        log.info("[BackoffRouter] {} -> queue={}, targetQueue={}", backoff, delayQueue.name(), targetQueue);
        republishCounter(MetricsConfig.RESULT_CONFIRMED).increment();
        delaySummary().record(attempt.nextExpirationMs());
        eventLogger.republished(targetQueue, delayQueue, attempt);

        return RepublishResult.ofConfirmed(attempt, delayQueue.name());
    }

    private void publishOnce(DelayQueue delayQueue, Message message, String targetQueue) {
        try {
            publisher.publish(delayQueue, message, targetQueue);
            publishAttemptCounter(MetricsConfig.RESULT_CONFIRMED).increment();
        } catch (UndeliverableMessageException e) {
            log.warn("[BackoffRouter] publish returned. queue={}, targetQueue={}, replyCode={}",
                    delayQueue.name(), targetQueue, e.getReplyCode());
            publishAttemptCounter(MetricsConfig.RESULT_UNDELIVERABLE).increment();
            throw e;
        }
    }

    private Counter republishCounter(String result) {
        return Counter.builder(MetricsConfig.METRIC_REPUBLISH)
                .tag(MetricsConfig.TAG_RESULT, result)
                .register(meterRegistry);
    }

    private Counter publishAttemptCounter(String result) {
        return Counter.builder(MetricsConfig.METRIC_PUBLISH_ATTEMPTS)
                .tag(MetricsConfig.TAG_RESULT, result)
                .register(meterRegistry);
    }

    private DistributionSummary delaySummary() {
        return DistributionSummary.builder(MetricsConfig.METRIC_DELAY)
                .baseUnit("milliseconds")
                .register(meterRegistry);
    }
}
