package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.exception.InvalidArgumentException;
import org.springframework.stereotype.Component;

@Component
public class EmailOptionsValidator {

    private final TempMailProperties properties;

    public EmailOptionsValidator(TempMailProperties properties) {
        this.properties = properties;
    }

    public void validateExpiryTime(Long expiryTime) {
        if (expiryTime == null || !properties.getExpiryOptions().contains(expiryTime)) {
            throw new InvalidArgumentException("Tempo de expiração inválido");
        }
    }

    public void validateDomain(String domain) {
        if (domain == null || !properties.getDomains().contains(domain)) {
            throw new InvalidArgumentException("Domínio inválido");
        }
    }
}
