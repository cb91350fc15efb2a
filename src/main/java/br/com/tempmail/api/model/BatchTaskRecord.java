package br.com.tempmail.api.model;

import br.com.tempmail.api.model.enums.TaskStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "batch_task", indexes = {
        @Index(name = "batch_task_user_id_idx", columnList = "user_id"),
        @Index(name = "batch_task_created_at_idx", columnList = "created_at")
})
@Getter
@Setter
public class BatchTaskRecord {

    // Mesmo ID da tarefa efêmera
    @Id
    @Column(length = 32)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private String domain;

    @Column(name = "total_count", nullable = false)
    private Integer totalCount;

    @Column(name = "created_count", nullable = false)
    private Integer createdCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public static BatchTaskRecord from(BatchTask task) {
        BatchTaskRecord record = new BatchTaskRecord();
        record.setId(task.getTaskId());
        record.setUserId(task.getUserId());
        record.setDomain(task.getDomain());
        record.setTotalCount(task.getTotalCount());
        record.setCreatedCount(task.getCreatedCount());
        record.setStatus(task.getStatus());
        record.setError(task.getError());
        record.setCreatedAt(task.getCreatedAt());
        record.setCompletedAt(task.getCompletedAt());
        return record;
    }
}
