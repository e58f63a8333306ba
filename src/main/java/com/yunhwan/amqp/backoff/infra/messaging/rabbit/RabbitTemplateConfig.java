package com.yunhwan.amqp.backoff.infra.messaging.rabbit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.amqp.RabbitTemplateCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class RabbitTemplateConfig {

    /**
     * RabbitTemplate 전역 설정
     * - mandatory: true (라우팅 실패 시 Return 수신)
     * - ReturnsCallback: 라우팅 실패 로그 (실패 판정은 CorrelationData 기준으로 publisher 에서 처리)
     */
    @Bean
    public RabbitTemplateCustomizer backoffRabbitTemplateCustomizer() {
        return template -> {
            template.setMandatory(true);
            template.setReturnsCallback(returned -> {
                var props = returned.getMessage().getMessageProperties();
                log.warn("[RabbitTemplate] Message RETURNED. backoff={}, replyCode={}, replyText={}, exchange={}, routingKey={}",
                        props.getHeaders().get("backoff"),
                        returned.getReplyCode(),
                        returned.getReplyText(),
                        returned.getExchange(),
                        returned.getRoutingKey()
                );
            });
        };
    }
}
