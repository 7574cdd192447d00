package com.nowqueue;

import com.nowqueue.engine.GraphHealth;
import com.nowqueue.engine.PrioritizationEngine;
import com.nowqueue.explain.UnblockingCut;
import com.nowqueue.scheduler.NowQueue;
import com.nowqueue.scheduler.QueueEntry;
import com.nowqueue.scoring.Factor;
import com.nowqueue.scoring.FactorBreakdown;
import com.nowqueue.spring.EnableNowQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Example Spring Boot application demonstrating the Now Queue engine.
 */
@SpringBootApplication
@EnableNowQueue
public class NowQueueApplication {

    private static final Logger log = LoggerFactory.getLogger(NowQueueApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(NowQueueApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(PrioritizationEngine engine) {
        return args -> {
            log.info("=== Now Queue Demo Started ===");

            GraphHealth health = engine.health();
            if (!health.dagOk()) {
                log.warn("Cycle {} (suggest removing {})", health.cyclePath(), health.breakSuggestion());
            }

            NowQueue queue = engine.refresh();
            log.info("Phase '{}', snapshot v{}, {} of {} minutes, strategy {}",
                    queue.phase(), queue.snapshotVersion(), queue.totalMinutes(),
                    queue.timeboxMinutes(), queue.strategy());

            for (QueueEntry entry : queue.entries()) {
                log.info("{}. [{}] {} ({} min, score {}) - {}", entry.position(), entry.course(),
                        entry.title(), entry.estMinutes(), String.format("%.2f", entry.score()),
                        entry.reason().label());

                FactorBreakdown breakdown = engine.explain(entry.taskId());
                for (Factor factor : breakdown.factors()) {
                    log.info("     {} = {} x {} = {}", factor.name(), String.format("%.3f", factor.rawValue()),
                            factor.weight(), String.format("%.3f", factor.contribution()));
                }
            }
            if (!queue.relaxed().isEmpty()) {
                log.info("Relaxed constraints: {}", queue.relaxed());
            }

            for (String taskId : args) {
                UnblockingCut cut = engine.minimalUnblockingCut(taskId);
                log.info("To unblock {}: {}", taskId, cut.reachable() ? cut.taskIds() : "unreachable (cycle)");
            }

            log.info("=== Now Queue Demo Finished ===");
        };
    }
}
