package com.yunhwan.amqp.backoff.common.exception;

/**
 * 브로커가 메시지를 라우팅하지 못한 케이스 (basic.return 또는 NO_ROUTE 채널 에러).
 * 일시적인 토폴로지 경합일 수 있어 내부에서 제한 횟수만큼 재시도한다.
 */
public class UndeliverableMessageException extends RuntimeException {

    private final int replyCode;
    private final String replyText;
    private final String exchange;
    private final String routingKey;

    public UndeliverableMessageException(int replyCode, String replyText, String exchange, String routingKey) {
        super("Message undeliverable. replyCode=" + replyCode + ", replyText=" + replyText
                + ", exchange=" + exchange + ", routingKey=" + routingKey);
        this.replyCode = replyCode;
        this.replyText = replyText;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public UndeliverableMessageException(String message, String exchange, String routingKey, Throwable cause) {
        super(message, cause);
        this.replyCode = 0;
        this.replyText = null;
        this.exchange = exchange;
        this.routingKey = routingKey;
    }

    public int getReplyCode() {
        return replyCode;
    }

    public String getReplyText() {
        return replyText;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
