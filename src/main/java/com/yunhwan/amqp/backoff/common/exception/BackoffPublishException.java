package com.yunhwan.amqp.backoff.common.exception;

/**
 * 브로커 NACK, confirm timeout 등 backoff 재발행 자체가 실패한 케이스.
 */
public class BackoffPublishException extends RuntimeException {

    public BackoffPublishException(String message) {
        super(message);
    }

    public BackoffPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
