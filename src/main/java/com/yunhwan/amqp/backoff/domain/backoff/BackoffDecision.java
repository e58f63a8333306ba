package com.yunhwan.amqp.backoff.domain.backoff;

import com.yunhwan.amqp.backoff.common.exception.BackoffExpiredException;

public record BackoffDecision(
        Outcome outcome,
        BackoffAttempt attempt,
        BackoffExpiredException expired
) {
    public enum Outcome { DELAY, EXPIRED }

    public static BackoffDecision ofDelay(BackoffAttempt attempt) {
        return new BackoffDecision(Outcome.DELAY, attempt, null);
    }

    public static BackoffDecision ofExpired(BackoffExpiredException expired) {
        return new BackoffDecision(Outcome.EXPIRED, null, expired);
    }

    public boolean isDelay() { return outcome == Outcome.DELAY; }
    public boolean isExpired() { return outcome == Outcome.EXPIRED; }

    public long delayMs() {
        if (attempt == null) {
            throw new IllegalStateException("no delay for outcome " + outcome);
        }
        return attempt.nextExpirationMs();
    }
}
