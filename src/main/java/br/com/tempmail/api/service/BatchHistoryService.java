package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.dto.BatchDownload;
import br.com.tempmail.api.dto.BatchHistoryResponse;
import br.com.tempmail.api.dto.BatchTaskRecordDTO;
import br.com.tempmail.api.dto.BatchTaskStatusDTO;
import br.com.tempmail.api.exception.ForbiddenException;
import br.com.tempmail.api.exception.InvalidArgumentException;
import br.com.tempmail.api.exception.ResourceNotFoundException;
import br.com.tempmail.api.model.BatchTask;
import br.com.tempmail.api.model.BatchTaskRecord;
import br.com.tempmail.api.model.enums.TaskStatus;
import br.com.tempmail.api.repository.BatchTaskRecordRepository;
import br.com.tempmail.api.security.CurrentUser;
import br.com.tempmail.api.store.AddressStore;
import br.com.tempmail.api.store.BatchTaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Leitura das tarefas em lote: status, histórico e download da lista de endereços.
 */
@Service
public class BatchHistoryService {

    private static final Logger logger = LoggerFactory.getLogger(BatchHistoryService.class);

    private final BatchTaskStore taskStore;
    private final BatchTaskRecordRepository recordRepository;
    private final AddressStore addressStore;
    private final TempMailProperties.Batch batch;

    public BatchHistoryService(BatchTaskStore taskStore,
                               BatchTaskRecordRepository recordRepository,
                               AddressStore addressStore,
                               TempMailProperties properties) {
        this.taskStore = taskStore;
        this.recordRepository = recordRepository;
        this.addressStore = addressStore;
        this.batch = properties.getBatch();
    }

    public BatchTaskStatusDTO getStatus(CurrentUser user, String taskId) {
        BatchTask task = taskStore.find(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Tarefa não existe ou expirou"));
        verifyOwnership(task.getUserId(), user);
        return new BatchTaskStatusDTO(task);
    }

    @Transactional(readOnly = true)
    public BatchHistoryResponse listHistory(CurrentUser user, Integer limit, Integer offset) {
        int effectiveLimit = limit == null || limit < 1 ? batch.getHistoryDefaultLimit() : Math.min(limit, batch.getHistoryMaxLimit());
        int effectiveOffset = offset == null || offset < 0 ? 0 : offset;

        List<BatchTaskRecordDTO> history = recordRepository.findHistoryPage(user.id(), effectiveLimit, effectiveOffset)
                .stream()
                .map(BatchTaskRecordDTO::new)
                .collect(Collectors.toList());
        long total = recordRepository.countByUserId(user.id());

        return new BatchHistoryResponse(history, total, effectiveLimit, effectiveOffset);
    }

    /**
     * Lista de endereços de um lote concluído, um por linha.
     * Usa a lista exata da tarefa efêmera; se ela já expirou, reconstrói a partir da tabela
     * de e-mails (janela de tempo + domínio), o que pode não bater exatamente.
     */
    @Transactional(readOnly = true)
    public BatchDownload downloadAddresses(CurrentUser user, String taskId) {
        List<String> addresses;

        Optional<BatchTask> ephemeral = taskStore.find(taskId);
        if (ephemeral.isPresent()) {
            BatchTask task = ephemeral.get();
            verifyOwnership(task.getUserId(), user);
            verifyCompleted(task.getStatus());
            addresses = task.getEmailList() != null ? task.getEmailList() : List.of();
        } else {
            BatchTaskRecord record = taskStore.findRecord(taskId)
                    .orElseThrow(() -> new ResourceNotFoundException("Tarefa não existe ou expirou"));
            verifyOwnership(record.getUserId(), user);
            verifyCompleted(record.getStatus());
            addresses = reconstruct(record);
        }

        if (addresses.isEmpty()) {
            throw new InvalidArgumentException("Não há endereços disponíveis para download");
        }
        return new BatchDownload("emails-" + taskId + ".txt", String.join("\n", addresses));
    }

    private List<String> reconstruct(BatchTaskRecord record) {
        LocalDateTime to = record.getCompletedAt() != null ? record.getCompletedAt() : LocalDateTime.now();
        List<String> addresses = addressStore.findCreatedInWindow(
                record.getUserId(), record.getDomain(), record.getCreatedAt(), to, record.getCreatedCount());
        if (addresses.size() < record.getCreatedCount()) {
            logger.info("Reconstrução parcial do lote {}: {} de {} endereços", record.getId(), addresses.size(), record.getCreatedCount());
        }
        return addresses;
    }

    private void verifyOwnership(String ownerId, CurrentUser user) {
        if (!ownerId.equals(user.id())) {
            throw new ForbiddenException("Sem permissão para acessar esta tarefa");
        }
    }

    private void verifyCompleted(TaskStatus status) {
        if (status != TaskStatus.COMPLETED) {
            throw new InvalidArgumentException("A tarefa ainda não foi concluída");
        }
    }
}
