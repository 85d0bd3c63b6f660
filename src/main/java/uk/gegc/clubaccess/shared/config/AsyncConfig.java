package uk.gegc.clubaccess.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.aop.interceptor.SimpleAsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for asynchronous work.
 *
 * <ul>
 *   <li>{@code syncTaskExecutor}: community and enrollment provider calls</li>
 *   <li>{@code notificationTaskExecutor}: fire-and-forget admin notifications</li>
 * </ul>
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.sync.core-pool-size:4}")
    private int syncCorePoolSize;

    @Value("${async.sync.max-pool-size:8}")
    private int syncMaxPoolSize;

    @Value("${async.sync.queue-capacity:50}")
    private int syncQueueCapacity;

    @Value("${async.notification.core-pool-size:1}")
    private int notificationCorePoolSize;

    @Value("${async.notification.max-pool-size:2}")
    private int notificationMaxPoolSize;

    @Value("${async.notification.queue-capacity:100}")
    private int notificationQueueCapacity;

    @Bean(name = "syncTaskExecutor")
    public ThreadPoolTaskExecutor syncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(syncCorePoolSize);
        executor.setMaxPoolSize(syncMaxPoolSize);
        executor.setQueueCapacity(syncQueueCapacity);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("access-sync-");
        // Caller runs the provider call itself when the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Sync Task Executor configured - Core: {}, Max: {}, Queue: {}",
                syncCorePoolSize, syncMaxPoolSize, syncQueueCapacity);
        return executor;
    }

    @Bean(name = "notificationTaskExecutor")
    public ThreadPoolTaskExecutor notificationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(notificationCorePoolSize);
        executor.setMaxPoolSize(notificationMaxPoolSize);
        executor.setQueueCapacity(notificationQueueCapacity);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("admin-notify-");
        // drop notifications when the queue is full
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Notification Task Executor configured - Core: {}, Max: {}, Queue: {}",
                notificationCorePoolSize, notificationMaxPoolSize, notificationQueueCapacity);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return notificationTaskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new SimpleAsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(Throwable ex, Method method, Object... params) {
                log.error("Uncaught exception in async method: {}.{}() with parameters: {}",
                        method.getDeclaringClass().getSimpleName(),
                        method.getName(),
                        Arrays.toString(params), ex);
                super.handleUncaughtException(ex, method, params);
            }
        };
    }
}
