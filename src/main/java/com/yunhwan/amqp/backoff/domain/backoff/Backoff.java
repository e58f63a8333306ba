package com.yunhwan.amqp.backoff.domain.backoff;

import com.yunhwan.amqp.backoff.common.exception.BackoffExpiredException;

import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff
 * <p>
 * 실패 하나(원인 예외 하나)에 대응하는 재시도 스케줄 계산기.
 * <ul>
 *   <li>x-death 이력에서 시도 횟수를 복원</li>
 *   <li>limit 초과 시 EXPIRED (원인 예외를 cause 로 보존)</li>
 *   <li>스케줄 값 + 가우시안 jitter -> 다음 대기 시간(ms)</li>
 * </ul>
 * 계산 결과는 인스턴스에 기록되어 {@link #toString()} 진단 출력에 쓰인다.
 */
public class Backoff {

    private final RetryPolicy policy;
    private final Throwable cause;
    private final Random random;

    private BackoffAttempt lastAttempt;

    public Backoff(RetryPolicy policy, Throwable cause) {
        this(policy, cause, null);
    }

    /**
     * @param random jitter 샘플링용. null 이면 호출 스레드의 ThreadLocalRandom
     */
    public Backoff(RetryPolicy policy, Throwable cause, Random random) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        this.policy = policy;
        this.cause = cause;
        this.random = random;
    }

    public BackoffDecision next(DeliveryHistory history, String backoffExchangeName) {
        DeliveryHistory safeHistory = history == null ? DeliveryHistory.empty() : history;
        long totalAttempts = safeHistory.totalAttempts(backoffExchangeName);

        if (policy.hasLimit() && totalAttempts >= policy.limit()) {
            String message = String.format(
                    "Backoff aborted after '%d' retries (~%.0f seconds)",
                    policy.limit(), policy.maxDelay() / 1000.0
            );
            return BackoffDecision.ofExpired(new BackoffExpiredException(message, totalAttempts, cause));
        }

        long expiration = policy.scheduleItem(toIndex(totalAttempts));

        if (policy.isRandomised()) {
            long randomised = (long) (expiration + randomSource().nextGaussian() * policy.randomSigma());
            expiration = roundToNearest(randomised, policy.jitterGroupSize());
        }

        // 분포 꼬리에서 나온 음수 방지
        expiration = Math.abs(expiration);

        BackoffAttempt attempt = new BackoffAttempt(totalAttempts, expiration);
        this.lastAttempt = attempt;
        return BackoffDecision.ofDelay(attempt);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    public Throwable getCause() {
        return cause;
    }

    public Optional<BackoffAttempt> lastAttempt() {
        return Optional.ofNullable(lastAttempt);
    }

    @Override
    public String toString() {
        return "Backoff(" + (lastAttempt != null ? lastAttempt.toString() : "uninitialised") + ")";
    }

    static long roundToNearest(long value, double interval) {
        return (long) (interval * Math.rint(value / interval));
    }

    private Random randomSource() {
        return random != null ? random : ThreadLocalRandom.current();
    }

    private static int toIndex(long totalAttempts) {
        return totalAttempts > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) totalAttempts;
    }
}
