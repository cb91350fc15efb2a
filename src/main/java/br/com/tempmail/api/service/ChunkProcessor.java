package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.dto.ProgressSnapshot;
import br.com.tempmail.api.exception.GenerationExhaustedException;
import br.com.tempmail.api.exception.ResourceNotFoundException;
import br.com.tempmail.api.model.BatchTask;
import br.com.tempmail.api.model.enums.TaskStatus;
import br.com.tempmail.api.store.BatchTaskStore;
import br.com.tempmail.api.util.ExpiryTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Avança uma tarefa em lote por um pedaço limitado a cada chamada.
 * <p>
 * Pode ser disparado mais de uma vez para a mesma tarefa (worker interno e polling do cliente),
 * inclusive ao mesmo tempo. Não há lock: o progresso é gravado com compare-and-swap sobre a
 * versão da tarefa e, em caso de conflito, reaplicado sobre a cópia mais nova. A unicidade
 * dos endereços fica a cargo do banco.
 */
@Service
public class ChunkProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ChunkProcessor.class);

    static final int MAX_CAS_ATTEMPTS = 5;

    private final BatchTaskStore taskStore;
    private final AddressGenerator addressGenerator;
    private final AddressBatchWriter addressWriter;
    private final int chunkSize;

    public ChunkProcessor(BatchTaskStore taskStore,
                          AddressGenerator addressGenerator,
                          AddressBatchWriter addressWriter,
                          TempMailProperties properties) {
        this.taskStore = taskStore;
        this.addressGenerator = addressGenerator;
        this.addressWriter = addressWriter;
        this.chunkSize = properties.getBatch().getChunkSize();
    }

    public ProgressSnapshot advance(String taskId) {
        BatchTask task = load(taskId);

        // Tarefa já finalizada: nada a fazer, devolve o estado atual
        if (task.getStatus().isTerminal()) {
            return new ProgressSnapshot(task);
        }

        if (task.getStatus() == TaskStatus.PENDING) {
            task = startProcessing(task);
            if (task.getStatus().isTerminal()) {
                return new ProgressSnapshot(task);
            }
        }

        int toProcess = Math.min(chunkSize, task.getTotalCount() - task.getProcessedCount());

        try {
            List<String> accepted = addressGenerator.generate(task.getDomain(), toProcess);
            if (accepted.isEmpty()) {
                throw new GenerationExhaustedException(
                        "Não foi possível gerar endereços únicos para " + task.getDomain() + ", tente novamente mais tarde");
            }

            LocalDateTime now = LocalDateTime.now();
            LocalDateTime expiresAt = ExpiryTimes.expiresAt(task.getExpiryTime(), now);
            List<String> persisted = addressWriter.persist(accepted, task.getUserId(), expiresAt, now);

            BatchTask updated = mergeProgress(task, accepted.size(), persisted);
            logger.info("Tarefa {}: {}/{} processados, {} criados ({})", taskId,
                    updated.getProcessedCount(), updated.getTotalCount(), updated.getCreatedCount(), updated.getStatus());
            return new ProgressSnapshot(updated);

        } catch (RuntimeException e) {
            logger.error("Falha ao processar lote da tarefa " + taskId, e);
            recordFailure(taskId, e);
            throw e;
        }
    }

    private BatchTask load(String taskId) {
        return taskStore.find(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Tarefa não existe ou expirou: " + taskId));
    }

    /**
     * PENDING -> PROCESSING, gravado antes de qualquer geração.
     * Se outro disparo chegou primeiro, segue com a cópia dele.
     */
    private BatchTask startProcessing(BatchTask task) {
        BatchTask current = task;
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            current.markProcessing(LocalDateTime.now());
            if (taskStore.compareAndSave(current)) {
                logger.info("Tarefa {} em processamento ({} endereços)", current.getTaskId(), current.getTotalCount());
                return current;
            }
            current = load(task.getTaskId());
            if (current.getStatus() != TaskStatus.PENDING) {
                return current;
            }
        }
        // Disputa persistente só na primeira transição: grava sem versão
        current.markProcessing(LocalDateTime.now());
        taskStore.save(current);
        return current;
    }

    /**
     * Soma o resultado do lote na cópia mais recente da tarefa.
     * Conflito de versão: relê e reaplica, até MAX_CAS_ATTEMPTS vezes.
     */
    private BatchTask mergeProgress(BatchTask task, int accepted, List<String> persisted) {
        BatchTask current = task;

        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            if (current.getStatus().isTerminal()) {
                logger.warn("Tarefa {} já estava {}; {} endereço(s) deste lote não foram contabilizados",
                        current.getTaskId(), current.getStatus(), persisted.size());
                return current;
            }

            int counted = current.applyChunk(accepted, persisted, LocalDateTime.now());

            if (taskStore.compareAndSave(current)) {
                if (counted < persisted.size()) {
                    logger.warn("Tarefa {}: {} endereço(s) excedentes criados por disparos concorrentes",
                            current.getTaskId(), persisted.size() - counted);
                }
                if (current.getStatus() == TaskStatus.COMPLETED) {
                    logger.info("Tarefa {} concluída: {} endereços criados", current.getTaskId(), current.getCreatedCount());
                    taskStore.flushRecord(current);
                }
                return current;
            }

            logger.debug("Conflito de versão na tarefa {} (tentativa {})", task.getTaskId(), attempt);
            current = load(task.getTaskId());
        }

        logger.warn("Progresso da tarefa {} descartado após {} conflitos de versão; o próximo disparo corrige",
                task.getTaskId(), MAX_CAS_ATTEMPTS);
        return current;
    }

    /**
     * Marca a tarefa como FAILED nas duas camadas. Best-effort: se nem isso der certo, só loga.
     */
    private void recordFailure(String taskId, RuntimeException cause) {
        try {
            taskStore.find(taskId).ifPresent(task -> {
                if (task.getStatus().isTerminal()) {
                    return;
                }
                String message = cause.getMessage() != null ? cause.getMessage() : "Falha no processamento";
                task.markFailed(message, LocalDateTime.now());
                taskStore.save(task);
                taskStore.flushRecord(task);
            });
        } catch (RuntimeException e) {
            logger.error("Não foi possível registrar a falha da tarefa " + taskId, e);
        }
    }
}
