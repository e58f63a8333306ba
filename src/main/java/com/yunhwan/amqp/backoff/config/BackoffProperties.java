package com.yunhwan.amqp.backoff.config;

import com.yunhwan.amqp.backoff.domain.backoff.RetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "backoff")
public class BackoffProperties {

    /**
     * 단계별 대기 시간(ms). 스케줄을 넘는 시도는 마지막 값 사용
     */
    @NotEmpty
    private List<@PositiveOrZero Long> schedule = new ArrayList<>(RetryPolicy.DEFAULT_SCHEDULE);

    /**
     * 최대 재시도 횟수 (0 = 무제한)
     */
    @PositiveOrZero
    private int limit = RetryPolicy.DEFAULT_LIMIT;

    /**
     * jitter 표준편차(ms), 0이면 jitter 없음
     */
    @PositiveOrZero
    private long randomSigma = RetryPolicy.DEFAULT_RANDOM_SIGMA;

    @Min(1)
    private int randomGroupsPerSigma = RetryPolicy.DEFAULT_RANDOM_GROUPS_PER_SIGMA;

    @Valid
    private Publish publish = new Publish();

    @Valid
    private Declare declare = new Declare();

    public RetryPolicy toPolicy() {
        return new RetryPolicy(schedule, limit, randomSigma, randomGroupsPerSigma);
    }

    @Getter @Setter
    public static class Publish {
        // 브로커 confirm 대기 시간
        @Min(1)
        private long confirmTimeoutMs = 3_000;
        // Return/NO_ROUTE 시 전체 발행 시도 횟수(최초 포함)
        @Min(1)
        private int maxAttempts = 3;
        @PositiveOrZero
        private long backoffMs = 100;
    }

    @Getter @Setter
    public static class Declare {
        @Min(1)
        private int maxAttempts = 3;
        @PositiveOrZero
        private long backoffMs = 200;
    }
}
