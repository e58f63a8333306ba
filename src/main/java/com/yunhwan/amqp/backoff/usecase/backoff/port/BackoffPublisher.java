package com.yunhwan.amqp.backoff.usecase.backoff.port;

import com.yunhwan.amqp.backoff.common.exception.UndeliverableMessageException;
import com.yunhwan.amqp.backoff.domain.backoff.DelayQueue;
import org.springframework.amqp.core.Message;

public interface BackoffPublisher {

    /**
     * 원본 메시지를 delay 큐로 재발행한다.
     * 브로커 confirm 까지 기다리며, 라우팅 실패는 {@link UndeliverableMessageException} 으로 알린다.
     *
     * @param targetQueue 만료 후 돌아갈 원래 큐 이름 (routing key 로 사용)
     */
    void publish(DelayQueue delayQueue, Message original, String targetQueue);
}
