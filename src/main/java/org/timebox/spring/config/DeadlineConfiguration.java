package org.timebox.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.timebox.execution.Deadlines;
import org.timebox.execution.timer.DeadlineTimer;
import org.timebox.execution.timer.ExecutorDeadlineTimer;
import org.timebox.execution.timer.VertxDeadlineTimer;
import org.timebox.log.Logger;
import org.timebox.log.LoggerFactory;
import org.timebox.metric.Metrics;

@Configuration
public class DeadlineConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(DeadlineConfiguration.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    Vertx vertx(@Value("${vertx.event-loop-pool-size:0}") int eventLoopPoolSize) {
        final int poolSize = eventLoopPoolSize > 0 ? eventLoopPoolSize : VertxOptions.DEFAULT_EVENT_LOOP_POOL_SIZE;

        logger.info("Creating Vert.x instance with {} event loop threads", poolSize);
        return Vertx.vertx(new VertxOptions().setEventLoopPoolSize(poolSize));
    }

    @Bean
    @ConditionalOnMissingBean
    MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    Metrics metrics(MeterRegistry meterRegistry) {
        return new Metrics(meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "deadline.timer", name = "type", havingValue = "vertx", matchIfMissing = true)
    DeadlineTimer vertxDeadlineTimer(Vertx vertx) {
        return new VertxDeadlineTimer(vertx);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "deadline.timer", name = "type", havingValue = "executor")
    DeadlineTimer executorDeadlineTimer(@Value("${deadline.timer.thread-name:deadline-timer}") String threadName) {
        return new ExecutorDeadlineTimer(threadName);
    }

    @Bean
    Deadlines deadlines(DeadlineTimer deadlineTimer, Metrics metrics) {
        return new Deadlines(deadlineTimer, metrics);
    }
}
