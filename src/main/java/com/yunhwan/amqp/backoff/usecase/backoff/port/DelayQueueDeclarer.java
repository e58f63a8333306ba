package com.yunhwan.amqp.backoff.usecase.backoff.port;

import com.yunhwan.amqp.backoff.domain.backoff.DelayQueue;

/**
 * backoff exchange / delay 큐 / 바인딩을 브로커에 선언한다.
 * 같은 delay 로 여러 번 호출해도 결과는 동일해야 한다(idempotent).
 */
public interface DelayQueueDeclarer {

    /**
     * 모든 delay 큐가 공유하는 headers exchange 이름.
     */
    String exchangeName();

    DelayQueue declare(long delayMs);
}
