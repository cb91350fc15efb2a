package br.com.tempmail.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateBatchRequest(
        @NotBlank String domain,
        @NotNull Long expiryTime,      // ms; 0 = nunca expira
        @NotNull @JsonAlias("batch") Integer totalCount
) {}
