package com.flowmetrics.service.core.buffer;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BufferConfig {

    @Bean
    @ConditionalOnMissingBean
    public FlushFailureListener flushFailureListener() {
        return new LoggingFlushFailureListener();
    }
}
