package org.panes.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class TaskExecutorConfig {

    @Bean(name = "archiveOpenExecutor")
    public AsyncTaskExecutor archiveOpenExecutor(ArchiveProperties archiveProperties) {
        ArchiveProperties.OpenExecutor settings = archiveProperties.getOpenExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setThreadNamePrefix(settings.getThreadNamePrefix());
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
