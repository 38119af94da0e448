package com.phillippitts.interviewpilot.config;

import com.phillippitts.interviewpilot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for session steps, blocking engine work and timers.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on the expected number of concurrent interviews.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Shared pool behind every session's serial executor. Session steps are short and never block.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}, so a saturated pool slows
     * the submitter down instead of dropping a session step.
     *
     * @return executor for session steps
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        return buildExecutor(threadPoolProperties.getSession());
    }

    /**
     * Pool for blocking speech work such as pulling synthesized audio chunks. Tasks on this pool
     * are interrupted when their call times out or the session is cancelled.
     *
     * @return executor for engine I/O
     */
    @Bean(name = "ioExecutor")
    public Executor ioExecutor() {
        return buildExecutor(threadPoolProperties.getIo());
    }

    /**
     * Scheduler behind the interview clock's timers (deadlines, item caps, call timeouts). Also used
     * for {@code @Scheduled} tasks.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolProperties.TimerProperties timerProps = threadPoolProperties.getTimer();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(timerProps.getPoolSize());
        scheduler.setThreadNamePrefix(timerProps.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static Executor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread to keep
     * request and session ids in async logs.
     */
    static TaskDecorator mdcPropagation() {
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
