package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.dto.GenerateEmailRequest;
import br.com.tempmail.api.dto.GenerateEmailResponse;
import br.com.tempmail.api.exception.AddressConflictException;
import br.com.tempmail.api.exception.GenerationExhaustedException;
import br.com.tempmail.api.exception.InvalidArgumentException;
import br.com.tempmail.api.exception.StorageFailureException;
import br.com.tempmail.api.model.BatchTaskRecord;
import br.com.tempmail.api.model.EmailAddress;
import br.com.tempmail.api.model.enums.TaskStatus;
import br.com.tempmail.api.security.CurrentUser;
import br.com.tempmail.api.store.AddressStore;
import br.com.tempmail.api.store.BatchTaskStore;
import br.com.tempmail.api.util.ExpiryTimes;
import br.com.tempmail.api.util.RandomIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Criação síncrona: um endereço (nome escolhido ou aleatório) ou um lote pequeno,
 * até o limite do modo assíncrono. Lotes também entram no histórico.
 */
@Service
public class EmailGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(EmailGenerationService.class);

    private static final Pattern LOCAL_PART = Pattern.compile("^[A-Za-z0-9._]{1,64}$");

    private final AddressGenerator addressGenerator;
    private final AddressBatchWriter addressWriter;
    private final AddressStore addressStore;
    private final BatchTaskStore taskStore;
    private final QuotaService quotaService;
    private final EmailOptionsValidator optionsValidator;
    private final int maxSyncBatch;

    public EmailGenerationService(AddressGenerator addressGenerator,
                                  AddressBatchWriter addressWriter,
                                  AddressStore addressStore,
                                  BatchTaskStore taskStore,
                                  QuotaService quotaService,
                                  EmailOptionsValidator optionsValidator,
                                  TempMailProperties properties) {
        this.addressGenerator = addressGenerator;
        this.addressWriter = addressWriter;
        this.addressStore = addressStore;
        this.taskStore = taskStore;
        this.quotaService = quotaService;
        this.optionsValidator = optionsValidator;
        this.maxSyncBatch = properties.getBatch().getAsyncThreshold();
    }

    public GenerateEmailResponse generate(CurrentUser user, GenerateEmailRequest request) {
        int count = request.batch() != null ? request.batch() : 1;

        quotaService.ensureWithinQuota(user, count);

        if (count < 1 || count > maxSyncBatch) {
            throw new InvalidArgumentException("A quantidade deve estar entre 1 e " + maxSyncBatch);
        }
        optionsValidator.validateExpiryTime(request.expiryTime());
        optionsValidator.validateDomain(request.domain());

        LocalDateTime now = LocalDateTime.now();
        LocalDateTime expiresAt = ExpiryTimes.expiresAt(request.expiryTime(), now);

        if (count > 1) {
            return generateBatch(user, request.domain(), count, expiresAt, now);
        }
        return generateSingle(user, request.name(), request.domain(), expiresAt, now);
    }

    private GenerateEmailResponse generateBatch(CurrentUser user, String domain, int count,
                                                LocalDateTime expiresAt, LocalDateTime now) {
        List<String> accepted = addressGenerator.generate(domain, count);
        List<String> persisted = accepted.isEmpty()
                ? List.of()
                : addressWriter.persist(accepted, user.id(), expiresAt, now);

        if (persisted.isEmpty()) {
            throw new GenerationExhaustedException("Não foi possível gerar endereços únicos, tente novamente mais tarde");
        }

        // Registro no histórico para permitir consulta e download depois
        BatchTaskRecord record = new BatchTaskRecord();
        record.setId(RandomIds.taskId());
        record.setUserId(user.id());
        record.setDomain(domain);
        record.setTotalCount(persisted.size());
        record.setCreatedCount(persisted.size());
        record.setStatus(TaskStatus.COMPLETED);
        record.setCreatedAt(now);
        record.setCompletedAt(LocalDateTime.now());
        taskStore.saveRecord(record);

        logger.info("Lote síncrono {}: {} endereços em {} para {}", record.getId(), persisted.size(), domain, user.id());
        return GenerateEmailResponse.batch(persisted, record.getId());
    }

    private GenerateEmailResponse generateSingle(CurrentUser user, String name, String domain,
                                                 LocalDateTime expiresAt, LocalDateTime now) {
        String localPart;
        if (name == null || name.isBlank()) {
            localPart = RandomIds.localPart(AddressGenerator.LOCAL_PART_LENGTH);
        } else if (LOCAL_PART.matcher(name.trim()).matches()) {
            localPart = name.trim();
        } else {
            throw new InvalidArgumentException("Nome de e-mail inválido");
        }

        String address = localPart + "@" + domain;
        if (addressStore.exists(address)) {
            throw new AddressConflictException("Este endereço já está em uso");
        }

        try {
            EmailAddress saved = addressStore.insert(new EmailAddress(address, user.id(), now, expiresAt));
            return GenerateEmailResponse.single(saved.getId(), saved.getAddress());
        } catch (DataIntegrityViolationException e) {
            throw new AddressConflictException("Este endereço já está em uso");
        } catch (DataAccessException e) {
            throw new StorageFailureException("Falha ao criar o e-mail", e);
        }
    }
}
