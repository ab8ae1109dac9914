package com.phillippitts.livescribe.config;

import com.phillippitts.livescribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the transcription engine.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 * All pools copy the submitting thread's Log4j2 ThreadContext into the worker, so
 * {@code sessionId} survives every hop.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one input-stream consumer per session.
     *
     * <p>No queue: a consumer is long running, so a queued one would silently never start.
     * Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; the session start fails instead.
     *
     * @return executor for stream consumers
     */
    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        return build(threadPoolProperties.getSession(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs bounded external model calls.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the session thread makes the call itself, which throttles chunk intake.
     *
     * @return executor for model calls
     */
    @Bean(name = "modelExecutor")
    public ThreadPoolTaskExecutor modelExecutor() {
        return build(threadPoolProperties.getModel(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Delivers subscriber messages and post-processing handoffs.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; callers treat rejection as
     * deferred delivery so the pipeline never runs subscriber I/O.
     *
     * @return executor for event offload
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return build(threadPoolProperties.getEvent(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /** Copies the caller's ThreadContext into the worker and restores the worker's own afterwards. */
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
