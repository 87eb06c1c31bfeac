package com.investbyyourself.etl.config;

import com.investbyyourself.etl.service.retry.RetryExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryExecutor retryExecutor() {
        return new RetryExecutor();
    }
}
