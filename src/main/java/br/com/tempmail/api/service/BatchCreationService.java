package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.dto.CreateBatchRequest;
import br.com.tempmail.api.dto.CreateBatchResponse;
import br.com.tempmail.api.exception.InvalidArgumentException;
import br.com.tempmail.api.model.BatchTask;
import br.com.tempmail.api.model.enums.TaskStatus;
import br.com.tempmail.api.security.CurrentUser;
import br.com.tempmail.api.store.BatchTaskStore;
import br.com.tempmail.api.util.RandomIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;

@Service
public class BatchCreationService {

    private static final Logger logger = LoggerFactory.getLogger(BatchCreationService.class);

    private final BatchTaskStore taskStore;
    private final BatchTaskQueue taskQueue;
    private final QuotaService quotaService;
    private final EmailOptionsValidator optionsValidator;
    private final int asyncThreshold;

    public BatchCreationService(BatchTaskStore taskStore,
                                BatchTaskQueue taskQueue,
                                QuotaService quotaService,
                                EmailOptionsValidator optionsValidator,
                                TempMailProperties properties) {
        this.taskStore = taskStore;
        this.taskQueue = taskQueue;
        this.quotaService = quotaService;
        this.optionsValidator = optionsValidator;
        this.asyncThreshold = properties.getBatch().getAsyncThreshold();
    }

    /**
     * Valida o pedido, grava a tarefa como PENDING e enfileira o primeiro disparo.
     * Retorna na hora: o progresso é acompanhado pelo ID da tarefa.
     */
    public CreateBatchResponse createBatch(CurrentUser user, CreateBatchRequest request) {
        optionsValidator.validateExpiryTime(request.expiryTime());
        optionsValidator.validateDomain(request.domain());

        int totalCount = request.totalCount();
        if (totalCount < 1) {
            throw new InvalidArgumentException("A quantidade deve ser maior que zero");
        }

        quotaService.ensureWithinQuota(user, totalCount);

        // Lotes pequenos vão pelo caminho síncrono
        if (totalCount <= asyncThreshold) {
            throw new InvalidArgumentException(
                    "Use /api/emails/generate para criar até " + asyncThreshold + " endereços");
        }

        LocalDateTime now = LocalDateTime.now();
        BatchTask task = BatchTask.builder()
                .taskId(RandomIds.taskId())
                .userId(user.id())
                .domain(request.domain())
                .expiryTime(request.expiryTime())
                .totalCount(totalCount)
                .processedCount(0)
                .createdCount(0)
                .status(TaskStatus.PENDING)
                .emailList(new ArrayList<>())
                .createdAt(now)
                .updatedAt(now)
                .build();

        taskStore.create(task);
        logger.info("Tarefa {} criada: {} endereços em {} para {}", task.getTaskId(), totalCount, task.getDomain(), user.id());

        trigger(task.getTaskId());

        return new CreateBatchResponse(task.getTaskId(), TaskStatus.PENDING,
                "Tarefa de criação em lote iniciada, acompanhe o progresso pelo ID da tarefa");
    }

    // Best-effort: se não enfileirar, o polling do cliente dispara
    private void trigger(String taskId) {
        try {
            if (!taskQueue.offer(taskId)) {
                logger.warn("Fila de lotes cheia, tarefa {} aguardará o polling do cliente", taskId);
            }
        } catch (RuntimeException e) {
            logger.warn("Falha ao enfileirar a tarefa {}: {}", taskId, e.getMessage());
        }
    }
}
