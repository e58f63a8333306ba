package com.yunhwan.amqp.backoff.usecase.backoff;

import com.yunhwan.amqp.backoff.common.exception.BackoffExpiredException;
import com.yunhwan.amqp.backoff.common.exception.BackoffPublishException;
import com.yunhwan.amqp.backoff.common.exception.UndeliverableMessageException;
import com.yunhwan.amqp.backoff.config.BackoffProperties;
import com.yunhwan.amqp.backoff.config.BackoffRetryConfig;
import com.yunhwan.amqp.backoff.domain.backoff.Backoff;
import com.yunhwan.amqp.backoff.domain.backoff.RetryPolicy;
import com.yunhwan.amqp.backoff.infra.logging.BackoffEventLogger;
import com.yunhwan.amqp.backoff.infra.metrics.MetricsConfig;
import com.yunhwan.amqp.backoff.testsupport.stub.StubBackoffPublisher;
import com.yunhwan.amqp.backoff.testsupport.stub.StubDelayQueueDeclarer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * republish 흐름(계산 -> 선언 -> 발행 -> Return 재시도)을 테스트 더블로 검증한다.
 * <p>
 * Mockito 대신 직접 구현한 Test Double 을 사용한다.
 */
class BackoffRouterTest {

    private static final String TARGET_QUEUE = "orders.q";

    private StubDelayQueueDeclarer declarer;
    private StubBackoffPublisher publisher;
    private SimpleMeterRegistry meterRegistry;
    private BackoffRouter router;

    @BeforeEach
    void setUp() {
        declarer = new StubDelayQueueDeclarer();
        publisher = new StubBackoffPublisher();
        meterRegistry = new SimpleMeterRegistry();

        BackoffProperties.Publish publish = new BackoffProperties.Publish();
        publish.setMaxAttempts(3);
        publish.setBackoffMs(0);

        router = new BackoffRouter(
                declarer,
                publisher,
                BackoffRetryConfig.publishRetryTemplate(publish),
                new BackoffEventLogger(Clock.systemUTC()),
                meterRegistry
        );
    }

    @Test
    @DisplayName("delay 30000 이면 backoff--30000ms 큐를 선언하고 원래 큐 이름을 routing key 로 발행한다")
    void 정상_재발행() {
        Backoff backoff = backoff(List.of(30_000L), 0);
        Message message = message(Map.of());

        RepublishResult result = router.republish(backoff, message, TARGET_QUEUE);

        assertThat(result.isConfirmed()).isTrue();
        assertThat(result.queueName()).isEqualTo("backoff--30000ms");
        assertThat(result.attempt().nextExpirationMs()).isEqualTo(30_000L);

        assertThat(declarer.declared()).hasSize(1);
        assertThat(declarer.declared().get(0).queueArguments())
                .containsEntry("x-expires", 80_000L)
                .containsEntry("x-dead-letter-exchange", "");

        assertThat(publisher.attempts()).hasSize(1);
        StubBackoffPublisher.Published published = publisher.attempts().get(0);
        assertThat(published.targetQueue()).isEqualTo(TARGET_QUEUE);
        assertThat(published.message()).isSameAs(message);

        assertThat(meterRegistry.get(MetricsConfig.METRIC_REPUBLISH)
                .tag(MetricsConfig.TAG_RESULT, MetricsConfig.RESULT_CONFIRMED)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("x-death 이력이 limit 에 도달하면 EXPIRED 이고 큐 선언/발행은 일어나지 않는다")
    void limit_도달_시_선언_발행_없음() {
        RuntimeException original = new RuntimeException("handler failed");
        Backoff backoff = new Backoff(new RetryPolicy(List.of(10L, 20L), 2, 0, 5), original);

        RepublishResult result = router.republish(backoff, message(xDeath("backoff", 2L)), TARGET_QUEUE);

        assertThat(result.isExpired()).isTrue();
        assertThat(result.failure())
                .isInstanceOf(BackoffExpiredException.class)
                .hasCause(original);
        assertThat(declarer.declared()).isEmpty();
        assertThat(publisher.attempts()).isEmpty();

        assertThatThrownBy(result::orElseThrow).isSameAs(result.failure());
        assertThat(meterRegistry.get(MetricsConfig.METRIC_REPUBLISH)
                .tag(MetricsConfig.TAG_RESULT, MetricsConfig.RESULT_EXPIRED)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("x-death 이력의 backoff exchange 횟수로 다음 delay 를 고른다")
    void x_death_이력으로_delay_선택() {
        Backoff backoff = backoff(List.of(10L, 20L, 30L), 0);

        RepublishResult result = router.republish(backoff, message(xDeath("backoff", 2L)), TARGET_QUEUE);

        assertThat(result.attempt().totalAttempts()).isEqualTo(2L);
        assertThat(result.queueName()).isEqualTo("backoff--30ms");
        assertThat(backoff).hasToString("Backoff(retry #3 in 30ms)");
    }

    @Test
    @DisplayName("첫 발행이 Return 되면 토폴로지를 다시 선언하고 재발행하여 성공한다 (발행 2회)")
    void Return_1회_후_성공() {
        publisher.failFirst(1);

        RepublishResult result = router.republish(backoff(List.of(10L), 0), message(Map.of()), TARGET_QUEUE);

        assertThat(result.isConfirmed()).isTrue();
        assertThat(publisher.attempts()).hasSize(2);
        // 최초 선언 + 재시도 전 재선언
        assertThat(declarer.declared()).hasSize(2).allMatch(q -> q.name().equals("backoff--10ms"));

        assertThat(meterRegistry.get(MetricsConfig.METRIC_PUBLISH_ATTEMPTS)
                .tag(MetricsConfig.TAG_RESULT, MetricsConfig.RESULT_UNDELIVERABLE)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Return 이 계속되면 최대 시도 횟수 후 UNDELIVERABLE 로 끝난다")
    void Return_반복_시_UNDELIVERABLE() {
        publisher.failAlways();

        RepublishResult result = router.republish(backoff(List.of(10L), 0), message(Map.of()), TARGET_QUEUE);

        assertThat(result.isUndeliverable()).isTrue();
        assertThat(result.queueName()).isEqualTo("backoff--10ms");
        assertThat(result.failure()).isInstanceOf(UndeliverableMessageException.class);
        assertThat(publisher.attempts()).hasSize(3);

        assertThatThrownBy(result::orElseThrow).isInstanceOf(UndeliverableMessageException.class);
        assertThat(meterRegistry.get(MetricsConfig.METRIC_REPUBLISH)
                .tag(MetricsConfig.TAG_RESULT, MetricsConfig.RESULT_UNDELIVERABLE)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("NACK 등 라우팅 외 실패는 재시도하지 않고 호출자에게 전파된다")
    void 라우팅_외_실패는_즉시_전파() {
        publisher.throwNext(new BackoffPublishException("Broker NACK. reason=test"));

        assertThatThrownBy(() -> router.republish(backoff(List.of(10L), 0), message(Map.of()), TARGET_QUEUE))
                .isInstanceOf(BackoffPublishException.class);
        assertThat(publisher.attempts()).hasSize(1);
    }

    @Test
    @DisplayName("대상 큐 이름이 비어 있으면 즉시 실패한다")
    void 대상_큐_누락() {
        assertThatThrownBy(() -> router.republish(backoff(List.of(10L), 0), message(Map.of()), " "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(declarer.declared()).isEmpty();
    }

    private static Backoff backoff(List<Long> schedule, int limit) {
        return new Backoff(new RetryPolicy(schedule, limit, 0, 5), new RuntimeException("boom"));
    }

    private static Message message(Map<String, Object> headers) {
        MessageProperties props = new MessageProperties();
        headers.forEach(props::setHeader);
        return new Message("{\"orderId\":1}".getBytes(StandardCharsets.UTF_8), props);
    }

    private static Map<String, Object> xDeath(String exchange, long count) {
        Map<String, Object> death = new HashMap<>();
        death.put("exchange", exchange);
        death.put("count", count);
        death.put("queue", "backoff--10ms");
        death.put("reason", "expired");
        return Map.of("x-death", List.of(death));
    }
}
