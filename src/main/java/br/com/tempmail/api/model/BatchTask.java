package br.com.tempmail.api.model;

import br.com.tempmail.api.model.enums.TaskStatus;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cópia de trabalho de uma tarefa de criação em lote. Vive no armazenamento efêmero
 * (chave {@code batch_task:<taskId>}) e só é alterada pelo ChunkProcessor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchTask {

    private String taskId;
    private String userId;
    private String domain;

    // Milissegundos; 0 = nunca expira
    private long expiryTime;

    private int totalCount;
    private int processedCount;
    private int createdCount;

    private TaskStatus status;
    private String error;

    @Builder.Default
    private List<String> emailList = new ArrayList<>();

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;

    // Sequência de escrita, usada no compare-and-swap do armazenamento efêmero
    private long version;

    public void markProcessing(LocalDateTime now) {
        transitionTo(TaskStatus.PROCESSING);
        this.updatedAt = now;
    }

    public void markFailed(String message, LocalDateTime now) {
        transitionTo(TaskStatus.FAILED);
        this.error = message;
        this.updatedAt = now;
        this.completedAt = now;
    }

    /**
     * Aplica o resultado de um lote. Retorna quantos endereços foram de fato contabilizados
     * em createdCount (pode ser menor que persisted.size() se outra invocação já fechou a conta).
     */
    public int applyChunk(int accepted, List<String> persisted, LocalDateTime now) {
        if (status != TaskStatus.PROCESSING) {
            throw new IllegalStateException("Tarefa " + taskId + " não está em processamento: " + status);
        }
        processedCount = Math.min(totalCount, processedCount + accepted);

        int room = Math.max(0, processedCount - createdCount);
        int counted = Math.min(room, persisted.size());
        if (emailList == null) {
            emailList = new ArrayList<>();
        }
        emailList.addAll(persisted.subList(0, counted));
        createdCount += counted;
        updatedAt = now;

        if (processedCount >= totalCount) {
            processedCount = totalCount;
            transitionTo(TaskStatus.COMPLETED);
            completedAt = now;
        }
        return counted;
    }

    public int progressPercent() {
        if (totalCount <= 0) {
            return 0;
        }
        return (int) Math.round(processedCount * 100.0 / totalCount);
    }

    public boolean hasMore() {
        return !status.isTerminal() && processedCount < totalCount;
    }

    private void transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Transição inválida " + status + " -> " + next + " na tarefa " + taskId);
        }
        this.status = next;
    }
}
