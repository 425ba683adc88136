package com.phillippitts.insightbot.config;

import com.phillippitts.insightbot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executors that run session loops and on-demand analyses.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the number of guilds served.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor hosting the periodic analysis loops, one thread per active session.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A loop occupies its thread for
     * the whole session, so running it on the caller would block the request that started it.
     * A rejected start is rolled back by the session manager.
     *
     * <p>Thread naming: configured via {@code threadpool.session.thread-name-prefix}.
     *
     * @return executor for session loops
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getSession());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        // loops exit promptly once their session is stopped
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Executor for manual analyses and stop sequences.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the task,
     * providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread to preserve request and guild correlation IDs in async logs.
     *
     * @return executor for on-demand analyses
     */
    @Bean(name = "analysisExecutor")
    public Executor analysisExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getAnalysis());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker and restores the worker's
     * own context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
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
