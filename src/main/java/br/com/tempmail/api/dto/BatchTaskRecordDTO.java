package br.com.tempmail.api.dto;

import br.com.tempmail.api.model.BatchTaskRecord;
import br.com.tempmail.api.model.enums.TaskStatus;

import java.time.LocalDateTime;

public record BatchTaskRecordDTO(
        String id,
        String domain,
        Integer totalCount,
        Integer createdCount,
        TaskStatus status,
        String error,
        LocalDateTime createdAt,
        LocalDateTime completedAt
) {
    public BatchTaskRecordDTO(BatchTaskRecord record) {
        this(
                record.getId(),
                record.getDomain(),
                record.getTotalCount(),
                record.getCreatedCount(),
                record.getStatus(),
                record.getError(),
                record.getCreatedAt(),
                record.getCompletedAt()
        );
    }
}
