package com.arbiter.core.value;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Provides the {@link ValueMemoryStore} behind {@link GlobalValueMemory}.
 * <p>
 * By default the state is kept in a JSON file ({@code arbiter.memory.file}).
 * With {@code arbiter.memory.persistent=false} an in-memory store is used and
 * nothing survives a restart.
 */
@Configuration
public class ValueMemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(ValueMemoryConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "arbiter.memory", name = "persistent", havingValue = "true", matchIfMissing = true)
    public ValueMemoryStore jsonFileValueMemoryStore(MemoryProperties properties) {
        Path file = Path.of(properties.getFile());
        log.info("Using JSON file value memory at {}", file.toAbsolutePath());
        return new JsonFileValueMemoryStore(file);
    }

    @Bean
    @ConditionalOnMissingBean(ValueMemoryStore.class)
    public ValueMemoryStore inMemoryValueMemoryStore() {
        log.info("Using in-memory value memory (state will not persist across restarts)");
        return new InMemoryValueMemoryStore();
    }
}
