package com.expirebot.expiry;

import com.expirebot.expiry.config.ExpirebotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExpirebotProperties.class)
public class ExpiryServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpiryServiceApplication.class, args);
    }
}
