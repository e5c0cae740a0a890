package com.arbiter.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the configured {@link Policy} as a bean unless the application
 * supplies its own.
 */
@Configuration
public class PolicyConfig {

    private static final Logger log = LoggerFactory.getLogger(PolicyConfig.class);

    @Bean
    @ConditionalOnMissingBean(Policy.class)
    public Policy policy(PolicyProperties properties) {
        Policy policy = properties.toPolicy();
        log.info("Loaded policy '{}': max_loc={}, max_files={}, max_dependencies={}, {} forbidden pattern(s)",
                policy.name(), policy.budgets().maxLoc(), policy.budgets().maxFiles(),
                policy.budgets().maxDependencies(), policy.forbiddenPatterns().size());
        return policy;
    }
}
