package com.yunhwan.amqp.backoff.infra.metrics;

public final class MetricsConfig {

    private MetricsConfig() {}

    // republish 최종 결과 / 개별 발행 시도 / 적용된 delay 분포
    public static final String METRIC_REPUBLISH = "backoff.republish";
    public static final String METRIC_PUBLISH_ATTEMPTS = "backoff.publish.attempts";
    public static final String METRIC_DELAY = "backoff.delay";

    // 고카디널리티 금지(큐 이름/delay 값은 태그로 쓰지 않음)
    public static final String TAG_RESULT = "result";

    // 고정 결과값(집계 안정성)
    public static final String RESULT_CONFIRMED = "confirmed";
    public static final String RESULT_EXPIRED = "expired";
    public static final String RESULT_UNDELIVERABLE = "undeliverable";
}
