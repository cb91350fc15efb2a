package br.com.tempmail.api.dto;

import br.com.tempmail.api.model.BatchTask;
import br.com.tempmail.api.model.enums.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchTaskStatusDTO(
        String taskId,
        TaskStatus status,
        int totalCount,
        int processedCount,
        int createdCount,
        int progressPercent,
        String error,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public BatchTaskStatusDTO(BatchTask task) {
        this(
                task.getTaskId(),
                task.getStatus(),
                task.getTotalCount(),
                task.getProcessedCount(),
                task.getCreatedCount(),
                task.progressPercent(),
                task.getError(),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }
}
