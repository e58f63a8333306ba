package com.yunhwan.amqp.backoff.domain.backoff;

/**
 * 브로커가 dead-lettering 시 남긴 x-death 항목 하나.
 * queue/reason 은 진단용으로만 보관한다.
 */
public record DeathRecord(
        String exchange,
        long count,
        String queue,
        String reason
) {

    public static DeathRecord of(String exchange, long count) {
        return new DeathRecord(exchange, count, null, null);
    }

    public boolean isFrom(String exchangeName) {
        return exchange != null && exchange.equals(exchangeName);
    }
}
