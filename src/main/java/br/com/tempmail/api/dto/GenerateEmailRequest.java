package br.com.tempmail.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record GenerateEmailRequest(
        String name,            // Só no modo individual; vazio = aleatório
        @NotNull Long expiryTime,
        @NotBlank String domain,
        Integer batch           // null = 1
) {}
