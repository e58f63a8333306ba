package com.yunhwan.amqp.backoff.domain.backoff;

/**
 * republish 한 번에 대한 계산 결과.
 *
 * @param totalAttempts    지금까지 backoff 를 거친 횟수 (0부터)
 * @param nextExpirationMs 이번에 적용할 대기 시간(ms)
 */
public record BackoffAttempt(long totalAttempts, long nextExpirationMs) {

    public long retryNumber() {
        return totalAttempts + 1;
    }

    @Override
    public String toString() {
        return "retry #" + retryNumber() + " in " + nextExpirationMs + "ms";
    }
}
