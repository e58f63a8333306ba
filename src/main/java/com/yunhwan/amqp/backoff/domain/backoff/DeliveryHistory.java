package com.yunhwan.amqp.backoff.domain.backoff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * DeliveryHistory
 * <p>
 * 메시지에 붙은 x-death 헤더를 타입화한 값.
 * 시도 횟수는 로컬 카운터가 아니라 브로커가 기록한 이력에서만 계산한다.
 * (프로세스 재시작/다중 consumer 에서도 값이 어긋나지 않음)
 */
public record DeliveryHistory(List<DeathRecord> records) {

    public static final String X_DEATH_HEADER = "x-death";

    private static final DeliveryHistory EMPTY = new DeliveryHistory(List.of());

    public DeliveryHistory {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static DeliveryHistory empty() {
        return EMPTY;
    }

    public static DeliveryHistory of(DeathRecord... records) {
        return new DeliveryHistory(List.of(records));
    }

    /**
     * AMQP 헤더 맵에서 x-death 를 읽는다.
     * 형식이 맞지 않는 항목(exchange/count 누락 등)은 건너뛴다.
     */
    public static DeliveryHistory fromHeaders(Map<String, Object> headers) {
        if (headers == null) {
            return EMPTY;
        }
        Object raw = headers.get(X_DEATH_HEADER);
        if (!(raw instanceof List<?> entries)) {
            return EMPTY;
        }

        List<DeathRecord> records = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> death)) {
                continue;
            }
            Object exchange = death.get("exchange");
            Long count = toCount(death.get("count"));
            if (exchange == null || count == null) {
                continue;
            }
            records.add(new DeathRecord(
                    String.valueOf(exchange),
                    count,
                    stringOrNull(death.get("queue")),
                    stringOrNull(death.get("reason"))
            ));
        }
        return records.isEmpty() ? EMPTY : new DeliveryHistory(Collections.unmodifiableList(records));
    }

    /**
     * backoffExchangeName 을 거쳐 dead-letter 된 횟수의 합 (0부터 시작).
     */
    public long totalAttempts(String backoffExchangeName) {
        long total = 0;
        for (DeathRecord record : records) {
            if (record.isFrom(backoffExchangeName)) {
                total += record.count();
            }
        }
        return total;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    private static Long toCount(Object v) {
        if (v instanceof Number n) {
            return n.longValue();
        }
        if (v != null) {
            try {
                return Long.parseLong(v.toString().trim());
            } catch (NumberFormatException ignore) {
                // 숫자가 아니면 카운트에서 제외
            }
        }
        return null;
    }

    private static String stringOrNull(Object v) {
        return v == null ? null : String.valueOf(v);
    }
}
