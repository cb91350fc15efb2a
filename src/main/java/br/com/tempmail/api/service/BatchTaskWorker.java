package br.com.tempmail.api.service;

import br.com.tempmail.api.config.AsyncConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Consome a {@link BatchTaskQueue} e entrega cada tarefa ao {@link BatchTaskDriver}.
 * O loop roda no pool de lotes do Spring, que o interrompe no shutdown.
 */
@Service
@ConditionalOnProperty(prefix = "tempmail.batch.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchTaskWorker {

    private static final Logger logger = LoggerFactory.getLogger(BatchTaskWorker.class);

    private final BatchTaskQueue taskQueue;
    private final BatchTaskDriver taskDriver;
    private final TaskExecutor executor;

    public BatchTaskWorker(BatchTaskQueue taskQueue,
                           BatchTaskDriver taskDriver,
                           @Qualifier(AsyncConfig.BATCH_TASK_EXECUTOR) TaskExecutor executor) {
        this.taskQueue = taskQueue;
        this.taskDriver = taskDriver;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        executor.execute(this::consumeLoop);
        logger.info("Worker de tarefas em lote iniciado");
    }

    void consumeLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                String taskId = taskQueue.take();
                taskDriver.drive(taskId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                logger.error("Erro no loop do worker de lotes", e);
            }
        }
        logger.info("Worker de tarefas em lote encerrado");
    }
}
