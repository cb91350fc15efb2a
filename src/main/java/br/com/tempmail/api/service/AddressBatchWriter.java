package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.exception.StorageFailureException;
import br.com.tempmail.api.model.EmailAddress;
import br.com.tempmail.api.store.AddressStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Grava endereços em sub-lotes pequenos (limite de parâmetros por INSERT).
 * Se um sub-lote bate na restrição de unicidade (outra chamada inseriu o mesmo endereço
 * nesse meio tempo), ele é refeito linha a linha e os repetidos são pulados.
 */
@Service
public class AddressBatchWriter {

    private static final Logger logger = LoggerFactory.getLogger(AddressBatchWriter.class);

    private final AddressStore addressStore;
    private final int insertBatchSize;

    public AddressBatchWriter(AddressStore addressStore, TempMailProperties properties) {
        this.addressStore = addressStore;
        this.insertBatchSize = properties.getBatch().getInsertBatchSize();
    }

    /**
     * @return os endereços efetivamente gravados, na ordem recebida
     * @throws StorageFailureException em qualquer erro de banco que não seja colisão
     */
    public List<String> persist(List<String> addresses, String userId, LocalDateTime expiresAt, LocalDateTime now) {
        List<String> persisted = new ArrayList<>(addresses.size());

        for (int i = 0; i < addresses.size(); i += insertBatchSize) {
            int end = Math.min(i + insertBatchSize, addresses.size());
            List<String> batch = addresses.subList(i, end);

            try {
                addressStore.insertAll(toEntities(batch, userId, expiresAt, now));
                persisted.addAll(batch);
            } catch (DataIntegrityViolationException e) {
                logger.warn("Colisão no sub-lote {}-{}, inserindo um a um", i, end);
                persisted.addAll(insertOneByOne(batch, userId, expiresAt, now));
            } catch (DataAccessException e) {
                throw new StorageFailureException("Falha ao gravar endereços no banco: " + e.getMostSpecificCause().getMessage(), e);
            }
        }
        return persisted;
    }

    private List<String> insertOneByOne(List<String> batch, String userId, LocalDateTime expiresAt, LocalDateTime now) {
        List<String> persisted = new ArrayList<>(batch.size());
        for (String address : batch) {
            try {
                addressStore.insert(new EmailAddress(address, userId, now, expiresAt));
                persisted.add(address);
            } catch (DataIntegrityViolationException e) {
                logger.info("Endereço {} já existe, pulando", address);
            } catch (DataAccessException e) {
                throw new StorageFailureException("Falha ao gravar endereço no banco: " + e.getMostSpecificCause().getMessage(), e);
            }
        }
        return persisted;
    }

    // Entidades novas a cada tentativa: as de uma transação desfeita não são reaproveitadas
    private List<EmailAddress> toEntities(List<String> batch, String userId, LocalDateTime expiresAt, LocalDateTime now) {
        List<EmailAddress> entities = new ArrayList<>(batch.size());
        for (String address : batch) {
            entities.add(new EmailAddress(address, userId, now, expiresAt));
        }
        return entities;
    }
}
