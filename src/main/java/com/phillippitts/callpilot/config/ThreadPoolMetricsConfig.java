package com.phillippitts.callpilot.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes executor pool gauges via Micrometer.
 *
 * <p>For each pool ({@code dial}, {@code forward}):
 * <ul>
 *   <li>callpilot.pool.size - current number of threads</li>
 *   <li>callpilot.pool.active - threads actively executing tasks</li>
 *   <li>callpilot.pool.queued - tasks waiting in the queue</li>
 *   <li>callpilot.pool.completed - cumulative completed tasks</li>
 * </ul>
 * Gauges carry a {@code pool} tag. Available at {@code /actuator/metrics/callpilot.pool.active}
 * and on the Prometheus endpoint.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ThreadPoolTaskExecutor dialExecutor;
    private final ThreadPoolTaskExecutor forwardExecutor;

    public ThreadPoolMetricsConfig(@Qualifier("dialExecutor") ThreadPoolTaskExecutor dialExecutor,
                                   @Qualifier("forwardExecutor") ThreadPoolTaskExecutor forwardExecutor) {
        this.dialExecutor = dialExecutor;
        this.forwardExecutor = forwardExecutor;
    }

    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> {
            bind(registry, "dial", dialExecutor.getThreadPoolExecutor());
            bind(registry, "forward", forwardExecutor.getThreadPoolExecutor());
            LOG.info("Executor pool metrics registered: callpilot.pool.* available via /actuator/metrics");
        };
    }

    static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("callpilot.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("callpilot.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("callpilot.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);
        Gauge.builder("callpilot.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs a pool summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        log("dial", dialExecutor.getThreadPoolExecutor());
        log("forward", forwardExecutor.getThreadPoolExecutor());
    }

    private static void log(String pool, ThreadPoolExecutor executor) {
        LOG.info("{} pool health: size={}/{}, active={}, queued={}, completed={}",
                pool,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
