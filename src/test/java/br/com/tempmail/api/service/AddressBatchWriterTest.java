package br.com.tempmail.api.service;

import br.com.tempmail.api.config.TempMailProperties;
import br.com.tempmail.api.exception.StorageFailureException;
import br.com.tempmail.api.model.EmailAddress;
import br.com.tempmail.api.store.AddressStore;
import br.com.tempmail.api.store.InMemoryAddressStore;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class AddressBatchWriterTest {

    private final TempMailProperties properties = new TempMailProperties();
    private final LocalDateTime now = LocalDateTime.of(2025, 3, 1, 12, 0);
    private final LocalDateTime expiresAt = now.plusHours(1);

    private static List<String> addresses(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> "addr" + i + "@moemail.app")
                .collect(Collectors.toList());
    }

    @Test
    @SuppressWarnings("unchecked")
    void splitsInsertsIntoSubBatchesOfTwenty() {
        AddressStore store = mock(AddressStore.class);
        AddressBatchWriter writer = new AddressBatchWriter(store, properties);

        List<String> persisted = writer.persist(addresses(45), "user-1", expiresAt, now);

        assertEquals(45, persisted.size());
        ArgumentCaptor<List<EmailAddress>> captor = ArgumentCaptor.forClass(List.class);
        verify(store, times(3)).insertAll(captor.capture());
        List<Integer> sizes = captor.getAllValues().stream().map(List::size).collect(Collectors.toList());
        assertEquals(List.of(20, 20, 5), sizes);

        EmailAddress first = captor.getAllValues().get(0).get(0);
        assertEquals("user-1", first.getUserId());
        assertEquals(now, first.getCreatedAt());
        assertEquals(expiresAt, first.getExpiresAt());
    }

    @Test
    void fallsBackToSingleInsertsOnCollision() {
        InMemoryAddressStore store = new InMemoryAddressStore();
        store.seed("ADDR3@moemail.app", "outro", now, expiresAt);
        AddressBatchWriter writer = new AddressBatchWriter(store, properties);

        List<String> input = addresses(25);
        List<String> persisted = writer.persist(input, "user-1", expiresAt, now);

        List<String> expected = new ArrayList<>(input);
        expected.remove("addr3@moemail.app");
        assertEquals(expected, persisted);
        assertEquals(25, store.size());
    }

    @Test
    void otherDatabaseErrorsBecomeStorageFailure() {
        AddressStore store = mock(AddressStore.class);
        when(store.insertAll(anyList())).thenThrow(new DataAccessResourceFailureException("timeout"));
        AddressBatchWriter writer = new AddressBatchWriter(store, properties);

        StorageFailureException ex = assertThrows(StorageFailureException.class,
                () -> writer.persist(addresses(5), "user-1", expiresAt, now));
        assertTrue(ex.getMessage().contains("timeout"));
    }

    @Test
    void emptyInputWritesNothing() {
        AddressStore store = mock(AddressStore.class);
        AddressBatchWriter writer = new AddressBatchWriter(store, properties);

        assertTrue(writer.persist(List.of(), "user-1", expiresAt, now).isEmpty());
        verifyNoInteractions(store);
    }
}
