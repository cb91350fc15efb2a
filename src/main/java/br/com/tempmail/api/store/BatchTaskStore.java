package br.com.tempmail.api.store;

import br.com.tempmail.api.model.BatchTask;
import br.com.tempmail.api.model.BatchTaskRecord;
import br.com.tempmail.api.repository.BatchTaskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * As duas camadas de uma tarefa em lote: a cópia efêmera (progresso em andamento)
 * e o registro permanente em {@code batch_task} (histórico, gravado no estado terminal).
 */
@Service
public class BatchTaskStore {

    private static final Logger logger = LoggerFactory.getLogger(BatchTaskStore.class);

    private final EphemeralTaskStore ephemeralStore;
    private final BatchTaskRecordRepository recordRepository;

    public BatchTaskStore(EphemeralTaskStore ephemeralStore, BatchTaskRecordRepository recordRepository) {
        this.ephemeralStore = ephemeralStore;
        this.recordRepository = recordRepository;
    }

    public void create(BatchTask task) {
        ephemeralStore.put(task);
    }

    public Optional<BatchTask> find(String taskId) {
        return ephemeralStore.get(taskId);
    }

    public void save(BatchTask task) {
        ephemeralStore.put(task);
    }

    /**
     * Grava a tarefa somente se ninguém a alterou desde que ela foi lida.
     */
    public boolean compareAndSave(BatchTask task) {
        return ephemeralStore.compareAndSet(task, task.getVersion());
    }

    public Optional<BatchTaskRecord> findRecord(String taskId) {
        return recordRepository.findById(taskId);
    }

    public BatchTaskRecord saveRecord(BatchTaskRecord record) {
        return recordRepository.save(record);
    }

    /**
     * Upsert do registro permanente. Falha aqui não derruba o processamento:
     * a cópia efêmera continua sendo a fonte para o cliente.
     */
    public void flushRecord(BatchTask task) {
        try {
            recordRepository.save(BatchTaskRecord.from(task));
            logger.info("Histórico da tarefa {} gravado ({})", task.getTaskId(), task.getStatus());
        } catch (RuntimeException e) {
            logger.warn("Falha ao gravar histórico da tarefa {}: {}", task.getTaskId(), e.getMessage(), e);
        }
    }
}
