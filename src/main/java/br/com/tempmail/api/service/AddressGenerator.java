package br.com.tempmail.api.service;

import br.com.tempmail.api.model.EmailAddress;
import br.com.tempmail.api.store.AddressStore;
import br.com.tempmail.api.util.RandomIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Gera endereços aleatórios {@code <parte-local>@<domínio>} sem colisão.
 * Cada candidato é checado primeiro contra os já aceitos nesta chamada (memória)
 * e depois contra o banco. Colisões são descartadas em silêncio.
 */
@Service
public class AddressGenerator {

    private static final Logger logger = LoggerFactory.getLogger(AddressGenerator.class);

    static final int LOCAL_PART_LENGTH = 8;
    static final int MAX_ATTEMPTS_FACTOR = 5;

    private final AddressStore addressStore;

    public AddressGenerator(AddressStore addressStore) {
        this.addressStore = addressStore;
    }

    /**
     * Produz até {@code count} endereços únicos em até {@code 5 x count} tentativas.
     * Um resultado parcial não é erro: quem chama decide o que fazer com ele.
     */
    public List<String> generate(String domain, int count) {
        if (count <= 0) {
            return List.of();
        }

        List<String> accepted = new ArrayList<>(count);
        Set<String> seen = new HashSet<>();
        int maxAttempts = count * MAX_ATTEMPTS_FACTOR;
        int attempts = 0;

        while (accepted.size() < count && attempts < maxAttempts) {
            attempts++;
            String address = RandomIds.localPart(LOCAL_PART_LENGTH) + "@" + domain;

            if (!seen.add(EmailAddress.normalize(address))) {
                continue;
            }
            if (addressStore.exists(address)) {
                continue;
            }
            accepted.add(address);
        }

        if (accepted.size() < count) {
            logger.warn("Geração parcial para {}: {} de {} em {} tentativas", domain, accepted.size(), count, attempts);
        }
        return accepted;
    }
}
