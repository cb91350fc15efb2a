package br.com.tempmail.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR) // Nenhum endereço único dentro do limite de tentativas
public class GenerationExhaustedException extends RuntimeException {
    public GenerationExhaustedException(String message) {
        super(message);
    }
}
