package br.com.tempmail.api.service;

import br.com.tempmail.api.dto.ProgressSnapshot;
import br.com.tempmail.api.exception.ResourceNotFoundException;
import br.com.tempmail.api.exception.StorageFailureException;
import br.com.tempmail.api.model.enums.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

class BatchTaskDriverTest {

    private ChunkProcessor chunkProcessor;
    private BatchTaskDriver driver;

    @BeforeEach
    void setUp() {
        chunkProcessor = mock(ChunkProcessor.class);
        driver = new BatchTaskDriver(chunkProcessor);
    }

    static ProgressSnapshot snapshot(TaskStatus status, int processed, int total) {
        boolean hasMore = !status.isTerminal() && processed < total;
        return new ProgressSnapshot(status, processed, total, processed, Math.round(processed * 100f / total), hasMore, null);
    }

    @Test
    void drivesTaskUntilCompletion() {
        when(chunkProcessor.advance("t1")).thenReturn(
                snapshot(TaskStatus.PROCESSING, 100, 250),
                snapshot(TaskStatus.PROCESSING, 200, 250),
                snapshot(TaskStatus.COMPLETED, 250, 250));

        driver.drive("t1");

        verify(chunkProcessor, times(3)).advance("t1");
    }

    @Test
    void stopsWhenProgressStalls() {
        when(chunkProcessor.advance("t1")).thenReturn(
                snapshot(TaskStatus.PROCESSING, 100, 250),
                snapshot(TaskStatus.PROCESSING, 100, 250));

        driver.drive("t1");

        verify(chunkProcessor, times(2)).advance("t1");
    }

    @Test
    void failuresAreContainedInsideDriver() {
        when(chunkProcessor.advance("gone")).thenThrow(new ResourceNotFoundException("expirou"));
        when(chunkProcessor.advance("broken")).thenThrow(new StorageFailureException("banco fora", null));

        assertDoesNotThrow(() -> driver.drive("gone"));
        assertDoesNotThrow(() -> driver.drive("broken"));
    }
}
