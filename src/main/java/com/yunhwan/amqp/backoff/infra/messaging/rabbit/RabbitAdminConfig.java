package com.yunhwan.amqp.backoff.infra.messaging.rabbit;

import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitAdminConfig {

    @Bean
    public RabbitAdmin rabbitAdmin(ConnectionFactory connectionFactory) {
        RabbitAdmin admin = new RabbitAdmin(connectionFactory);
        admin.setAutoStartup(true); // 연결 시 backoff exchange declare
        // delay 큐 인자 불일치(PRECONDITION_FAILED) 등은 숨기지 않고 호출자에게 전달
        admin.setIgnoreDeclarationExceptions(false);
        return admin;
    }
}
