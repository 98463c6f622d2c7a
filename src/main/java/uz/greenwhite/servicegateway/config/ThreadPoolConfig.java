package uz.greenwhite.servicegateway.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ThreadPoolConfig {

    private final BatchProperties batchProperties;

    /**
     * Runs batch operations. Each chunk submits at most max-concurrency tasks,
     * so the pool only has to cover concurrent batches.
     */
    @Bean("orchestratorExecutor")
    public ThreadPoolTaskExecutor orchestratorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchProperties.getMaxConcurrency());
        executor.setMaxPoolSize(batchProperties.getPoolSize());
        executor.setQueueCapacity(batchProperties.getQueueCapacity());
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("orchestrator-");
        executor.setRejectedExecutionHandler(new CallerRunsWithLogging("orchestrator"));
        executor.setAllowCoreThreadTimeOut(true);
        executor.initialize();

        log.info("Orchestrator ThreadPool created: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                batchProperties.getQueueCapacity());

        return executor;
    }

    /**
     * Fire-and-forget critical alerts. Small and bounded; alerts beyond the
     * queue are dropped with a log line rather than slowing request threads.
     */
    @Bean("notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler((r, pool) ->
                log.warn("Notification queue full, alert dropped: queue={}", pool.getQueue().size()));
        executor.initialize();
        return executor;
    }

    /**
     * When the queue is full the submitting thread runs the task itself,
     * which throttles whoever is producing batch work.
     */
    static class CallerRunsWithLogging implements RejectedExecutionHandler {

        private final String poolName;

        CallerRunsWithLogging(String poolName) {
            this.poolName = poolName;
        }

        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("{} thread pool exhausted! queue={}, active={}, pool={}. Task will run on caller thread",
                    poolName,
                    executor.getQueue().size(),
                    executor.getActiveCount(),
                    executor.getPoolSize());

            if (!executor.isShutdown()) {
                r.run();
            }
        }
    }
}
