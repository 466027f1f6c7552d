package com.distributedsystems.bhr.exe;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConfigurationProperties(prefix = "bhr")
@Data
public class BhrConfig {
    private Expiry expiry = new Expiry();
    private Queue queue = new Queue();
    private Api api = new Api();
    private Confirmation confirmation = new Confirmation();

    @Bean
    public Clock bhrClock() {
        return Clock.systemUTC();
    }

    @Data
    public static class Expiry {
        private boolean enabled = true;
        private long sweepIntervalMs = 10_000L;
    }

    @Data
    public static class Queue {
        private int defaultLimit = 1000;
        private int maxLimit = 10_000;
    }

    @Data
    public static class Api {
        private String defaultRequester = "anonymous";
    }

    @Data
    public static class Confirmation {
        private int maxRetries = 6;
        private long backoffMs = 12L;
    }
}
