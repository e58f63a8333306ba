package com.yunhwan.amqp.backoff.domain.backoff;

import java.util.List;

/**
 * RetryPolicy
 * <p>
 * 역할:
 * - 백오프 스케줄(단계별 대기 시간), 최대 재시도 횟수, jitter 설정을 묶은 불변 설정값입니다.
 * - 스케줄 길이를 넘는 시도는 마지막 값으로 고정됩니다(steady-state delay).
 *   재시도 중단 여부는 {@code limit}만으로 결정합니다.
 *
 * @param schedule             단계별 대기 시간(ms). 비어 있으면 안 됨
 * @param limit                최대 재시도 횟수. 0이면 무제한
 * @param randomSigma          jitter 표준편차(ms). 0이면 jitter 없음
 * @param randomGroupsPerSigma jitter 반올림 단위(sigma 당 그룹 수)
 */
public record RetryPolicy(
        List<Long> schedule,
        int limit,
        long randomSigma,
        int randomGroupsPerSigma
) {

    public static final List<Long> DEFAULT_SCHEDULE = List.of(
            10_000L, 20_000L, 30_000L, 50_000L, 80_000L, 130_000L,
            210_000L, 240_000L, 350_000L, 450_000L, 500_000L, 800_000L
    );
    public static final int DEFAULT_LIMIT = 200;
    public static final long DEFAULT_RANDOM_SIGMA = 100L;
    public static final int DEFAULT_RANDOM_GROUPS_PER_SIGMA = 5;

    public RetryPolicy {
        if (schedule == null || schedule.isEmpty()) {
            throw new IllegalArgumentException("schedule must not be empty");
        }
        for (Long item : schedule) {
            if (item == null || item < 0) {
                throw new IllegalArgumentException("schedule items must be non-negative. schedule=" + schedule);
            }
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0. limit=" + limit);
        }
        if (randomSigma < 0) {
            throw new IllegalArgumentException("randomSigma must be >= 0. randomSigma=" + randomSigma);
        }
        if (randomGroupsPerSigma <= 0) {
            throw new IllegalArgumentException("randomGroupsPerSigma must be > 0. randomGroupsPerSigma=" + randomGroupsPerSigma);
        }
        schedule = List.copyOf(schedule);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_SCHEDULE, DEFAULT_LIMIT, DEFAULT_RANDOM_SIGMA, DEFAULT_RANDOM_GROUPS_PER_SIGMA);
    }

    /**
     * index 번째 시도의 기본 대기 시간. 스케줄 범위를 넘으면 마지막 값.
     */
    public long scheduleItem(int index) {
        if (index >= schedule.size()) {
            return schedule.get(schedule.size() - 1);
        }
        return schedule.get(Math.max(0, index));
    }

    /**
     * limit 회 모두 재시도했을 때의 이론상 총 대기 시간(ms). 무제한이면 0.
     */
    public long maxDelay() {
        long total = 0;
        for (int i = 0; i < limit; i++) {
            total += scheduleItem(i);
        }
        return total;
    }

    public boolean hasLimit() {
        return limit > 0;
    }

    public boolean isRandomised() {
        return randomSigma > 0;
    }

    /**
     * jitter 결과를 맞출 반올림 단위(ms). 예: sigma=100, groups=5 -> 20ms
     */
    public double jitterGroupSize() {
        return (double) randomSigma / randomGroupsPerSigma;
    }
}
