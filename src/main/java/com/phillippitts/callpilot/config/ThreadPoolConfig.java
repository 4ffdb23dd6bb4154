package com.phillippitts.callpilot.config;

import com.phillippitts.callpilot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by outreach dispatch and booking forwarding.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.dial.*} and
 * {@code threadpool.forward.*}).
 *
 * <p>Rejection policy for both pools is {@link ThreadPoolExecutor.AbortPolicy}: when the pool
 * and queue are full, {@code execute} throws a {@link java.util.concurrent.RejectedExecutionException}.
 * Submitters never run a task on their own thread. The dispatcher fails only the rejected session
 * and the forwarding fan-out records the rejected sink attempt as FAILED.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for outbound call placements. One task per swarm target, so a slow placement
     * never delays its siblings.
     *
     * @return configured executor for call placement
     */
    @Bean(name = "dialExecutor")
    public ThreadPoolTaskExecutor dialExecutor() {
        return buildExecutor(threadPoolProperties.getDial());
    }

    /**
     * Executor for booking forwarding. Runs the individual calendar and webhook attempts.
     *
     * @return configured executor for sink delivery
     */
    @Bean(name = "forwardExecutor")
    public ThreadPoolTaskExecutor forwardExecutor() {
        return buildExecutor(threadPoolProperties.getForward());
    }

    static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext of the submitting thread into the worker so campaign and
     * session ids stay on async log lines. The worker's own context is restored afterwards.
     */
    static TaskDecorator threadContextDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
