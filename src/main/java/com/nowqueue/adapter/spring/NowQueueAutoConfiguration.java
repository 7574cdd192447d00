package com.nowqueue.adapter.spring;

import com.nowqueue.config.ConfigLoader;
import com.nowqueue.config.EngineConfig;
import com.nowqueue.core.InMemoryTaskStore;
import com.nowqueue.core.Task;
import com.nowqueue.core.TaskSnapshotFactory;
import com.nowqueue.core.TaskStore;
import com.nowqueue.engine.DefaultPrioritizationEngine;
import com.nowqueue.engine.PrioritizationEngine;
import com.nowqueue.exception.ConfigurationException;
import com.nowqueue.phase.PhaseProvider;
import com.nowqueue.phase.PhaseProviders;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration for the Now Queue engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "nowqueue", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(NowQueueProperties.class)
public class NowQueueAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(NowQueueAutoConfiguration.class);

    private PrioritizationEngine engine;

    @Bean
    @ConditionalOnMissingBean
    public EngineConfig engineConfig(NowQueueProperties properties) {
        log.info("Loading Now Queue configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock nowQueueClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskStore taskStore(NowQueueProperties properties, Clock clock) {
        String path = properties.getSnapshotPath();
        if (path == null || path.isBlank()) {
            log.info("No task snapshot configured, starting with an empty store");
            return new InMemoryTaskStore(clock);
        }
        try (InputStream inputStream = ConfigLoader.getResource(path).getInputStream()) {
            List<Task> tasks = TaskSnapshotFactory.parse(inputStream);
            log.info("Seeded task store with {} tasks from: {}", tasks.size(), path);
            return new InMemoryTaskStore(clock, tasks);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load task snapshot from: " + path, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public PhaseProvider phaseProvider(EngineConfig config) {
        return PhaseProviders.from(config.phase());
    }

    @Bean
    @ConditionalOnMissingBean
    public PrioritizationEngine prioritizationEngine(EngineConfig config, TaskStore store,
                                                     PhaseProvider phaseProvider, Clock clock) {
        log.info("Creating PrioritizationEngine: {}", config.name());
        this.engine = new DefaultPrioritizationEngine(config, store, phaseProvider, clock);
        return this.engine;
    }

    @PreDestroy
    public void shutdown() {
        if (engine != null) {
            log.info("Shutting down PrioritizationEngine");
            engine.shutdown();
        }
    }
}
