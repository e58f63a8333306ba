package com.yunhwan.amqp.backoff.usecase.backoff;

import com.yunhwan.amqp.backoff.common.exception.BackoffExpiredException;
import com.yunhwan.amqp.backoff.common.exception.UndeliverableMessageException;
import com.yunhwan.amqp.backoff.domain.backoff.BackoffAttempt;

public record RepublishResult(
        Outcome outcome,
        BackoffAttempt attempt,
        String queueName,
        RuntimeException failure
) {
    public enum Outcome { CONFIRMED, EXPIRED, UNDELIVERABLE }

    public static RepublishResult ofConfirmed(BackoffAttempt attempt, String queueName) {
        return new RepublishResult(Outcome.CONFIRMED, attempt, queueName, null);
    }

    public static RepublishResult ofExpired(BackoffExpiredException expired) {
        return new RepublishResult(Outcome.EXPIRED, null, null, expired);
    }

    public static RepublishResult ofUndeliverable(BackoffAttempt attempt, String queueName,
                                                  UndeliverableMessageException undeliverable) {
        return new RepublishResult(Outcome.UNDELIVERABLE, attempt, queueName, undeliverable);
    }

    public boolean isConfirmed() { return outcome == Outcome.CONFIRMED; }
    public boolean isExpired() { return outcome == Outcome.EXPIRED; }
    public boolean isUndeliverable() { return outcome == Outcome.UNDELIVERABLE; }

    /**
     * 예외 흐름을 선호하는 호출자용: 실패 결과면 담긴 예외를 그대로 던진다.
     */
    public RepublishResult orElseThrow() {
        if (failure != null) {
            throw failure;
        }
        return this;
    }
}
