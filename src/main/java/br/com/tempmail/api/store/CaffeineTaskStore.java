package br.com.tempmail.api.store;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.exception.StorageFailureException;
import br.com.tempmail.api.model.BatchTask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Implementação em memória do armazenamento efêmero.
 * Os valores ficam serializados em JSON, como num KV externo: quem lê recebe sempre uma cópia.
 */
@Component
public class CaffeineTaskStore implements EphemeralTaskStore {

    private static final Logger logger = LoggerFactory.getLogger(CaffeineTaskStore.class);

    private final ObjectMapper objectMapper;
    private final Cache<String, String> cache;

    @Autowired
    public CaffeineTaskStore(ObjectMapper objectMapper, TempMailProperties properties) {
        this(objectMapper, properties.getBatch().getTaskTtl(), Ticker.systemTicker());
    }

    public CaffeineTaskStore(ObjectMapper objectMapper, Duration ttl, Ticker ticker) {
        this.objectMapper = objectMapper;
        // expireAfterWrite: cada put/compute reinicia a contagem
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
    }

    @Override
    public Optional<BatchTask> get(String taskId) {
        String json = cache.getIfPresent(EphemeralTaskStore.key(taskId));
        return Optional.ofNullable(json).map(this::read);
    }

    @Override
    public void put(BatchTask task) {
        cache.asMap().compute(EphemeralTaskStore.key(task.getTaskId()), (key, existing) -> {
            long stored = existing != null ? read(existing).getVersion() : 0L;
            task.setVersion(Math.max(stored, task.getVersion()) + 1);
            return write(task);
        });
    }

    @Override
    public boolean compareAndSet(BatchTask task, long expectedVersion) {
        String key = EphemeralTaskStore.key(task.getTaskId());
        String current = cache.getIfPresent(key);
        if (current == null || read(current).getVersion() != expectedVersion) {
            return false;
        }

        AtomicBoolean swapped = new AtomicBoolean(false);
        cache.asMap().computeIfPresent(key, (k, existing) -> {
            if (read(existing).getVersion() != expectedVersion) {
                return existing;
            }
            task.setVersion(expectedVersion + 1);
            swapped.set(true);
            return write(task);
        });

        if (!swapped.get()) {
            logger.debug("CAS perdido na tarefa {} (versão esperada {})", task.getTaskId(), expectedVersion);
        }
        return swapped.get();
    }

    private BatchTask read(String json) {
        try {
            return objectMapper.readValue(json, BatchTask.class);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException("Registro de tarefa corrompido no armazenamento efêmero", e);
        }
    }

    private String write(BatchTask task) {
        try {
            return objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException("Falha ao serializar a tarefa " + task.getTaskId(), e);
        }
    }
}
