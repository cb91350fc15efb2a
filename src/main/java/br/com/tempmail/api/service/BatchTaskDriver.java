package br.com.tempmail.api.service;

import br.com.tempmail.api.config.AsyncConfig;
import br.com.tempmail.api.dto.ProgressSnapshot;
import br.com.tempmail.api.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Leva uma tarefa até o fim, lote a lote, numa thread do pool de lotes.
 */
@Service
public class BatchTaskDriver {

    private static final Logger logger = LoggerFactory.getLogger(BatchTaskDriver.class);

    private final ChunkProcessor chunkProcessor;

    public BatchTaskDriver(ChunkProcessor chunkProcessor) {
        this.chunkProcessor = chunkProcessor;
    }

    /**
     * Chama {@code advance} até a tarefa terminar. Para também se uma chamada não avançar
     * o progresso (disputa com outro disparo): o polling do cliente assume dali.
     */
    @Async(AsyncConfig.BATCH_TASK_EXECUTOR)
    public void drive(String taskId) {
        try {
            ProgressSnapshot snapshot = chunkProcessor.advance(taskId);
            while (snapshot.hasMore()) {
                int before = snapshot.processedCount();
                snapshot = chunkProcessor.advance(taskId);
                if (snapshot.hasMore() && snapshot.processedCount() <= before) {
                    logger.warn("Tarefa {} não avançou ({}/{}), devolvendo ao polling",
                            taskId, snapshot.processedCount(), snapshot.totalCount());
                    return;
                }
            }
            logger.info("Tarefa {} finalizada pelo worker: {}", taskId, snapshot.status());
        } catch (ResourceNotFoundException e) {
            logger.warn("Tarefa {} não encontrada pelo worker (expirou?)", taskId);
        } catch (Exception e) {
            // A falha já foi registrada na tarefa pelo ChunkProcessor
            logger.warn("Worker interrompeu a tarefa {}: {}", taskId, e.getMessage());
        }
    }
}
