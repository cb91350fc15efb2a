package br.com.tempmail.api.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    public static final String BATCH_TASK_EXECUTOR = "batchTaskExecutor";

    /**
     * Pool dos lotes: uma thread fica com o loop que consome a fila,
     * as demais levam as tarefas até o fim.
     */
    @Bean(name = BATCH_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor batchTaskExecutor(TempMailProperties properties) {
        int threads = properties.getBatch().getWorker().getThreads() + 1;

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getBatch().getQueueCapacity());
        executor.setThreadNamePrefix("batch-task-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
