package lending.reward.ledger.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Telemetry Executor Configuration
 * Sink pushes run on this pool, never on the thread that holds the ledger lock.
 * A saturated pool rejects instead of running in the caller.
 */
@Slf4j
@Configuration
public class TelemetryExecutorConfig {

    @Value("${ledger.telemetry.executor.core-pool-size:2}")
    private int corePoolSize;

    @Value("${ledger.telemetry.executor.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${ledger.telemetry.executor.queue-capacity:1000}")
    private int queueCapacity;

    @Bean(name = "telemetryExecutor")
    public ThreadPoolTaskExecutor telemetryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("ledger-telemetry-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        log.info("Initialized telemetry executor: core={}, max={}, queue={}",
                corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
