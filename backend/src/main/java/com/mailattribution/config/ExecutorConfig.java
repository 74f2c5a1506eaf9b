package com.mailattribution.config;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for the detached contact export and its remote cleanup.
 *
 * <p>Cleanup runs on its own pool so a saturated export pool never delays deletion of remote
 * export jobs.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean("volumeExportExecutor")
    public ThreadPoolTaskExecutor volumeExportExecutor(AppProperties appProperties) {
        AppProperties.Volume.Export export = appProperties.getVolume().getExport();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(export.getCorePoolSize());
        executor.setMaxPoolSize(export.getMaxPoolSize());
        executor.setQueueCapacity(export.getQueueCapacity());
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("VolumeExport-");

        // In-flight exports are abandoned on shutdown; their cleanup still runs
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAllowCoreThreadTimeOut(true);

        executor.initialize();

        log.info(
                "Initialized VolumeExport ThreadPoolTaskExecutor: core={}, max={}, queue={}",
                export.getCorePoolSize(),
                export.getMaxPoolSize(),
                export.getQueueCapacity());

        return executor;
    }

    @Bean("exportCleanupExecutor")
    public ThreadPoolTaskExecutor exportCleanupExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("ExportCleanup-");

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.initialize();

        return executor;
    }

    /** Runs outbound calls so each attempt can be abandoned when it exceeds its timeout. */
    @Bean("upstreamCallExecutor")
    public ThreadPoolTaskExecutor upstreamCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("UpstreamCall-");

        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.initialize();

        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
