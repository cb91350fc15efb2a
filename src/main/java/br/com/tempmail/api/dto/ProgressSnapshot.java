package br.com.tempmail.api.dto;

import br.com.tempmail.api.model.BatchTask;
import br.com.tempmail.api.model.enums.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressSnapshot(
        TaskStatus status,
        int processedCount,
        int totalCount,
        int createdCount,
        int progressPercent,
        boolean hasMore,
        String error
) {
    public ProgressSnapshot(BatchTask task) {
        this(
                task.getStatus(),
                task.getProcessedCount(),
                task.getTotalCount(),
                task.getCreatedCount(),
                task.progressPercent(),
                task.hasMore(),
                task.getError()
        );
    }
}
