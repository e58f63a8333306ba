package com.yunhwan.amqp.backoff.infra.logging;

import com.yunhwan.amqp.backoff.common.exception.BackoffExpiredException;
import com.yunhwan.amqp.backoff.common.exception.UndeliverableMessageException;
import com.yunhwan.amqp.backoff.domain.backoff.BackoffAttempt;
import com.yunhwan.amqp.backoff.domain.backoff.DelayQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static net.logstash.logback.argument.StructuredArguments.entries;

@Slf4j
@Component
@RequiredArgsConstructor
public class BackoffEventLogger {

    private final Clock clock;

    public void republished(String targetQueue, DelayQueue delayQueue, BackoffAttempt attempt) {
        Map<String, Object> evt = createBaseEvent("backoff.republished", targetQueue);
        evt.put("delay_queue", delayQueue.name());
        evt.put("retry", attemptOf(attempt));

        log.info("backoff_event {}", entries(evt));
    }

    public void expired(String targetQueue, BackoffExpiredException expired) {
        Map<String, Object> evt = createBaseEvent("backoff.expired", targetQueue);
        evt.put("total_attempts", expired.getTotalAttempts());
        evt.put("reason", expired.getMessage());

        Throwable cause = expired.getCause();
        if (cause != null) {
            evt.put("error", mapOfNonNull(
                    "exception", cause.getClass().getName(),
                    "message", cause.getMessage()
            ));
        }

        log.warn("backoff_event {}", entries(evt));
    }

    public void undeliverable(String targetQueue, DelayQueue delayQueue, BackoffAttempt attempt,
                              UndeliverableMessageException e) {
        Map<String, Object> evt = createBaseEvent("backoff.undeliverable", targetQueue);
        evt.put("delay_queue", delayQueue.name());
        evt.put("retry", attemptOf(attempt));
        evt.put("broker", mapOfNonNull(
                "reply_code", e.getReplyCode(),
                "reply_text", e.getReplyText(),
                "exchange", e.getExchange(),
                "routing_key", e.getRoutingKey()
        ));

        log.error("backoff_event {}", entries(evt));
    }

    private Map<String, Object> createBaseEvent(String eventType, String targetQueue) {
        Map<String, Object> evt = new LinkedHashMap<>();
        evt.put("event_type", eventType);
        evt.put("event_id", UUID.randomUUID().toString());
        evt.put("occurred_at", OffsetDateTime.now(clock).toString());
        evt.put("target_queue", targetQueue);
        return evt;
    }

    private Map<String, Object> attemptOf(BackoffAttempt attempt) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("number", attempt.retryNumber());
        m.put("delay_ms", attempt.nextExpirationMs());
        return m;
    }

    // null 값은 넣지 않는다
    private Map<String, Object> mapOfNonNull(Object... kv) {
        if (kv.length % 2 != 0) {
            throw new IllegalArgumentException("kv length must be even. length=" + kv.length);
        }
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            Object v = kv[i + 1];
            if (v != null) {
                m.put(String.valueOf(kv[i]), v);
            }
        }
        return m;
    }
}
