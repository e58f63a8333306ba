package com.yunhwan.amqp.backoff.domain.backoff;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * DelayQueue
 * <p>
 * 대기 시간(ms) 하나에 대응하는 backoff 큐의 정의.
 * 이름/바인딩/큐 인자는 delay 값만으로 결정된다.
 * <pre>
 * name     : backoff--{delay}ms
 * binding  : {backoff: delay, x-match: any}  (headers exchange "backoff")
 * queue    : {x-expires: delay + 50000, x-dead-letter-exchange: ""}
 * </pre>
 * 만료된 메시지는 default exchange 로 dead-letter 되어 routing key(= 원래 큐 이름)로 돌아간다.
 */
public record DelayQueue(
        String name,
        String exchange,
        long delayMs,
        Map<String, Object> bindingArguments,
        Map<String, Object> queueArguments
) {

    public static final String EXCHANGE = "backoff";
    public static final String BACKOFF_HEADER = "backoff";
    public static final long EXPIRY_GRACE_PERIOD_MS = 50_000L;

    public static final String ARG_X_MATCH = "x-match";
    public static final String ARG_X_EXPIRES = "x-expires";
    public static final String ARG_X_DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";

    public DelayQueue {
        bindingArguments = Map.copyOf(bindingArguments);
        queueArguments = Map.copyOf(queueArguments);
    }

    public static DelayQueue forDelay(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0. delayMs=" + delayMs);
        }
        Map<String, Object> binding = new LinkedHashMap<>();
        binding.put(BACKOFF_HEADER, delayMs);
        binding.put(ARG_X_MATCH, "any");

        Map<String, Object> queue = new LinkedHashMap<>();
        queue.put(ARG_X_EXPIRES, delayMs + EXPIRY_GRACE_PERIOD_MS);
        queue.put(ARG_X_DEAD_LETTER_EXCHANGE, "");

        return new DelayQueue(queueName(delayMs), EXCHANGE, delayMs, binding, queue);
    }

    public static String queueName(long delayMs) {
        return "backoff--" + delayMs + "ms";
    }
}
