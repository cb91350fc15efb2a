package br.com.tempmail.api.dto;

import br.com.tempmail.api.model.enums.TaskStatus;

public record CreateBatchResponse(
        String taskId,
        TaskStatus status,
        String message
) {}
