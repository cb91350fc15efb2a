package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.dto.CreateBatchRequest;
import br.com.tempmail.api.dto.CreateBatchResponse;
import br.com.tempmail.api.exception.InvalidArgumentException;
import br.com.tempmail.api.exception.QuotaExceededException;
import br.com.tempmail.api.model.BatchTask;
import br.com.tempmail.api.model.enums.Role;
import br.com.tempmail.api.model.enums.TaskStatus;
import br.com.tempmail.api.repository.BatchTaskRecordRepository;
import br.com.tempmail.api.security.CurrentUser;
import br.com.tempmail.api.store.BatchTaskStore;
import br.com.tempmail.api.store.CaffeineTaskStore;
import br.com.tempmail.api.store.InMemoryAddressStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class BatchCreationServiceTest {

    private static final CurrentUser USER = new CurrentUser("user-1", Role.EMPEROR);

    private TempMailProperties properties;
    private InMemoryAddressStore addressStore;
    private BatchTaskStore taskStore;
    private BatchTaskQueue taskQueue;
    private BatchCreationService service;

    @BeforeEach
    void setUp() {
        properties = new TempMailProperties();
        addressStore = new InMemoryAddressStore();
        taskStore = new BatchTaskStore(
                new CaffeineTaskStore(new ObjectMapper().findAndRegisterModules(), Duration.ofHours(24), Ticker.systemTicker()),
                mock(BatchTaskRecordRepository.class));
        taskQueue = new BatchTaskQueue(properties);
        service = new BatchCreationService(taskStore, taskQueue,
                new QuotaService(addressStore, properties),
                new EmailOptionsValidator(properties),
                properties);
    }

    @Test
    void createsPendingTaskAndEnqueuesIt() throws InterruptedException {
        CreateBatchResponse response = service.createBatch(USER, new CreateBatchRequest("moemail.app", 3_600_000L, 250));

        assertEquals(TaskStatus.PENDING, response.status());
        assertEquals(16, response.taskId().length());
        assertNotNull(response.message());

        BatchTask task = taskStore.find(response.taskId()).orElseThrow();
        assertEquals("user-1", task.getUserId());
        assertEquals("moemail.app", task.getDomain());
        assertEquals(250, task.getTotalCount());
        assertEquals(0, task.getProcessedCount());
        assertEquals(0, task.getCreatedCount());
        assertEquals(TaskStatus.PENDING, task.getStatus());

        assertEquals(1, taskQueue.size());
        assertEquals(response.taskId(), taskQueue.take());
    }

    @Test
    void smallBatchesAreRedirectedToSynchronousEndpoint() {
        InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
                () -> service.createBatch(USER, new CreateBatchRequest("moemail.app", 3_600_000L, 30)));
        assertTrue(ex.getMessage().contains("/api/emails/generate"));
        assertEquals(0, taskQueue.size());
    }

    @Test
    void fiftyIsStillSynchronousAndFiftyOneIsNot() {
        assertThrows(InvalidArgumentException.class,
                () -> service.createBatch(USER, new CreateBatchRequest("moemail.app", 0L, 50)));
        assertDoesNotThrow(() -> service.createBatch(USER, new CreateBatchRequest("moemail.app", 0L, 51)));
    }

    @Test
    void rejectsUnknownExpiry() {
        assertThrows(InvalidArgumentException.class,
                () -> service.createBatch(USER, new CreateBatchRequest("moemail.app", 1234L, 100)));
    }

    @Test
    void rejectsUnknownDomain() {
        assertThrows(InvalidArgumentException.class,
                () -> service.createBatch(USER, new CreateBatchRequest("example.org", 3_600_000L, 100)));
    }

    @Test
    void rejectsNonPositiveCount() {
        assertThrows(InvalidArgumentException.class,
                () -> service.createBatch(USER, new CreateBatchRequest("moemail.app", 3_600_000L, 0)));
    }

    @Test
    void quotaIsCheckedBeforeThreshold() {
        LocalDateTime now = LocalDateTime.now();
        for (int i = 0; i < 28; i++) {
            addressStore.seed("ativo" + i + "@moemail.app", "civil", now, now.plusDays(1));
        }
        CurrentUser civilian = new CurrentUser("civil", Role.CIVILIAN);

        // 28 + 10 > 30: a cota barra antes do aviso de lote pequeno
        assertThrows(QuotaExceededException.class,
                () -> service.createBatch(civilian, new CreateBatchRequest("moemail.app", 3_600_000L, 10)));
    }

    @Test
    void fullQueueDoesNotFailCreation() {
        properties.getBatch().setQueueCapacity(1);
        BatchTaskQueue tinyQueue = new BatchTaskQueue(properties);
        tinyQueue.offer("ocupado");
        BatchCreationService withFullQueue = new BatchCreationService(taskStore, tinyQueue,
                new QuotaService(addressStore, properties), new EmailOptionsValidator(properties), properties);

        CreateBatchResponse response = withFullQueue.createBatch(USER, new CreateBatchRequest("moemail.app", 3_600_000L, 100));

        assertTrue(taskStore.find(response.taskId()).isPresent());
        assertEquals(1, tinyQueue.size());
    }
}
