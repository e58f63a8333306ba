package com.yunhwan.amqp.backoff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AmqpBackoffApplication {

	public static void main(String[] args) {
		SpringApplication.run(AmqpBackoffApplication.class, args);
	}

}
