package com.arbiter.core.execution;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Falls back to {@link DryRunExecutionAgent} unless the application provides
 * its own {@link ExecutionAgent} bean.
 */
@Configuration
public class ExecutionConfig {

    @Bean
    @ConditionalOnMissingBean(ExecutionAgent.class)
    public ExecutionAgent dryRunExecutionAgent() {
        return new DryRunExecutionAgent();
    }
}
