package br.com.tempmail.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT) // Retorna 409 (endereço já em uso)
public class AddressConflictException extends RuntimeException {
    public AddressConflictException(String message) {
        super(message);
    }
}
