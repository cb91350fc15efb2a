package br.com.tempmail.api.dto;

import java.util.List;

public record BatchHistoryResponse(
        List<BatchTaskRecordDTO> history,
        long total,
        int limit,
        int offset
) {}
