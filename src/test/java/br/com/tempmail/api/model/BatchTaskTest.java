package br.com.tempmail.api.model;

import br.com.tempmail.api.model.enums.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchTaskTest {

    private static BatchTask pendingTask(int total) {
        LocalDateTime now = LocalDateTime.now();
        return BatchTask.builder()
                .taskId("task-1")
                .userId("user-1")
                .domain("moemail.app")
                .totalCount(total)
                .status(TaskStatus.PENDING)
                .emailList(new ArrayList<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @Test
    void followsPendingProcessingCompleted() {
        BatchTask task = pendingTask(3);
        task.markProcessing(LocalDateTime.now());
        assertEquals(TaskStatus.PROCESSING, task.getStatus());

        int counted = task.applyChunk(3, List.of("a@moemail.app", "b@moemail.app", "c@moemail.app"), LocalDateTime.now());

        assertEquals(3, counted);
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertNotNull(task.getCompletedAt());
        assertFalse(task.hasMore());
        assertEquals(100, task.progressPercent());
    }

    @Test
    void terminalStatesAreFinal() {
        BatchTask task = pendingTask(10);
        task.markProcessing(LocalDateTime.now());
        task.markFailed("boom", LocalDateTime.now());

        assertThrows(IllegalStateException.class, () -> task.markProcessing(LocalDateTime.now()));
        assertThrows(IllegalStateException.class, () -> task.markFailed("again", LocalDateTime.now()));
        assertThrows(IllegalStateException.class, () -> task.applyChunk(1, List.of("x@moemail.app"), LocalDateTime.now()));
        assertEquals("boom", task.getError());
    }

    @Test
    void pendingTaskCannotFailBeforeProcessing() {
        BatchTask task = pendingTask(10);
        assertThrows(IllegalStateException.class, () -> task.markFailed("cedo demais", LocalDateTime.now()));
        assertEquals(TaskStatus.PENDING, task.getStatus());
    }

    @Test
    void applyChunkRequiresProcessing() {
        BatchTask task = pendingTask(10);
        assertThrows(IllegalStateException.class, () -> task.applyChunk(1, List.of("x@moemail.app"), LocalDateTime.now()));
    }

    @Test
    void processedCountIsClampedAndCreatedNeverExceedsProcessed() {
        BatchTask task = pendingTask(5);
        task.markProcessing(LocalDateTime.now());
        task.setProcessedCount(4);
        task.setCreatedCount(4);

        int counted = task.applyChunk(3, List.of("a@moemail.app", "b@moemail.app", "c@moemail.app"), LocalDateTime.now());

        assertEquals(5, task.getProcessedCount());
        assertEquals(5, task.getCreatedCount());
        assertEquals(1, counted);
        assertEquals(1, task.getEmailList().size());
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
    }

    @Test
    void partialChunkCountsOnlyPersistedAddresses() {
        BatchTask task = pendingTask(100);
        task.markProcessing(LocalDateTime.now());

        task.applyChunk(3, List.of("a@moemail.app", "b@moemail.app"), LocalDateTime.now());

        assertEquals(3, task.getProcessedCount());
        assertEquals(2, task.getCreatedCount());
        assertTrue(task.hasMore());
        assertEquals(3, task.progressPercent());
    }

    @Test
    void progressPercentIsRounded() {
        BatchTask task = pendingTask(3);
        task.setProcessedCount(2);
        assertEquals(67, task.progressPercent());
    }
}
