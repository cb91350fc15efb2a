package br.com.tempmail.api.dto;

import br.com.tempmail.api.model.enums.TaskStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerateEmailResponse(
        UUID id,
        String email,
        Integer count,
        List<String> emails,
        String taskId,
        TaskStatus status
) {
    public static GenerateEmailResponse single(UUID id, String email) {
        return new GenerateEmailResponse(id, email, null, null, null, null);
    }

    public static GenerateEmailResponse batch(List<String> emails, String taskId) {
        return new GenerateEmailResponse(null, null, emails.size(), emails, taskId, TaskStatus.COMPLETED);
    }
}
