package com.phillippitts.livescribe.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the engine's thread pools via Micrometer.
 *
 * <p>Gauges {@code livescribe.pool.size}, {@code .active}, {@code .queued} and
 * {@code .completed}, tagged {@code pool=session|model|event}. A health summary is logged
 * every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final Map<String, ThreadPoolTaskExecutor> pools = new LinkedHashMap<>();

    public ThreadPoolMetricsConfig(@Qualifier("sessionExecutor") ThreadPoolTaskExecutor sessionExecutor,
                                   @Qualifier("modelExecutor") ThreadPoolTaskExecutor modelExecutor,
                                   @Qualifier("eventExecutor") ThreadPoolTaskExecutor eventExecutor) {
        pools.put("session", sessionExecutor);
        pools.put("model", modelExecutor);
        pools.put("event", eventExecutor);
    }

    @Bean
    public MeterBinder livescribePoolMetrics() {
        return registry -> {
            pools.forEach((name, pool) -> bind(registry, name, pool.getThreadPoolExecutor()));
            LOG.info("Thread pool metrics registered for {}", pools.keySet());
        };
    }

    private static void bind(MeterRegistry registry, String name, ThreadPoolExecutor executor) {
        Tags tags = Tags.of("pool", name);
        Gauge.builder("livescribe.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tags(tags)
                .register(registry);
        Gauge.builder("livescribe.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tags(tags)
                .register(registry);
        Gauge.builder("livescribe.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tags(tags)
                .register(registry);
        Gauge.builder("livescribe.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tags(tags)
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        pools.forEach((name, pool) -> {
            ThreadPoolExecutor executor = pool.getThreadPoolExecutor();
            LOG.info("Thread pool {}: size={}/{}, active={}, queued={}, completed={}",
                    name,
                    executor.getPoolSize(),
                    executor.getMaximumPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size(),
                    executor.getCompletedTaskCount());
        });
    }
}
