package br.com.tempmail.api.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TaskStatus {
    PENDING,    // 0: Tarefa criada, aguardando o primeiro disparo
    PROCESSING, // 1: Em execução (um ou mais lotes já processados)
    COMPLETED,  // 2: Concluída, todos os endereços processados
    FAILED;     // 3: Falha (ex: erro de banco, geração esgotada)

    // No JSON o status vai em minúsculas ("pending"); no banco fica o nome do enum
    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromWireValue(String value) {
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * PENDING -> PROCESSING -> {COMPLETED, FAILED}. Estados terminais não saem mais.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
