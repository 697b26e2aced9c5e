package com.eyelevel.mediamigrator.config;

import com.eyelevel.mediamigrator.worker.PhaseExecutors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures one bounded thread pool per pipeline phase. Each pool is sized independently from
 * {@code app.migration.concurrency.*}; the orchestrator never submits more work than a pool has free slots.
 */
@Configuration
public class TaskExecutorConfig {

    @Bean(name = "downloadTaskExecutor")
    public ThreadPoolTaskExecutor downloadTaskExecutor(MigrationProperties properties) {
        return phaseExecutor("download-", properties.getConcurrency().getDownload());
    }

    @Bean(name = "extractTaskExecutor")
    public ThreadPoolTaskExecutor extractTaskExecutor(MigrationProperties properties) {
        return phaseExecutor("extract-", properties.getConcurrency().getExtract());
    }

    @Bean(name = "metadataTaskExecutor")
    public ThreadPoolTaskExecutor metadataTaskExecutor(MigrationProperties properties) {
        return phaseExecutor("metadata-", properties.getConcurrency().getMetadata());
    }

    @Bean(name = "uploadTaskExecutor")
    public ThreadPoolTaskExecutor uploadTaskExecutor(MigrationProperties properties) {
        return phaseExecutor("upload-", properties.getConcurrency().getUpload());
    }

    @Bean
    public PhaseExecutors phaseExecutors(@Qualifier("downloadTaskExecutor") ThreadPoolTaskExecutor downloadTaskExecutor,
                                         @Qualifier("extractTaskExecutor") ThreadPoolTaskExecutor extractTaskExecutor,
                                         @Qualifier("metadataTaskExecutor") ThreadPoolTaskExecutor metadataTaskExecutor,
                                         @Qualifier("uploadTaskExecutor") ThreadPoolTaskExecutor uploadTaskExecutor) {
        return new PhaseExecutors(downloadTaskExecutor, extractTaskExecutor, metadataTaskExecutor,
                                  uploadTaskExecutor);
    }

    private ThreadPoolTaskExecutor phaseExecutor(String threadNamePrefix, int size) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int poolSize = Math.max(1, size);
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        // Slots are claimed in the State Store before submission, so the queue only absorbs scheduling jitter.
        executor.setQueueCapacity(poolSize);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(300);
        return executor;
    }
}
