package br.com.tempmail.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR) // Erro de escrita no banco
public class StorageFailureException extends RuntimeException {
    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
