package com.yunhwan.amqp.backoff.common.exception;

/**
 * 재시도 한도(limit)를 모두 소진한 케이스.
 * cause 에는 재시도를 유발한 원래 예외가 그대로 들어 있다.
 * 최종 처리(영구 DLQ, 폐기, 알림 등)는 호출자가 결정한다.
 */
public class BackoffExpiredException extends RuntimeException {

    private final long totalAttempts;

    public BackoffExpiredException(String message, long totalAttempts, Throwable cause) {
        super(message, cause);
        this.totalAttempts = totalAttempts;
    }

    public long getTotalAttempts() {
        return totalAttempts;
    }
}
