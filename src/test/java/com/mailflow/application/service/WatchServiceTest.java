package com.mailflow.application.service;

import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.domain.model.WatchKey;
import com.mailflow.domain.model.WatchRegistration;
import com.mailflow.support.InMemoryWatchStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("WatchService")
class WatchServiceTest {

    private static final WatchKey KEY = new WatchKey("Gmail", "MailFlow");

    @Mock
    private MailboxClient mailbox;

    private InMemoryWatchStateStore store;
    private WatchService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryWatchStateStore();
        service = new WatchService(mailbox, store);
    }

    @Test
    @DisplayName("Keys are case-insensitive")
    void keysAreCaseInsensitive() {
        store.save(new WatchRegistration("gmail", "projects/p/topics/t", "mailflow", "w1",
            Instant.parse("2030-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z"), true, Map.of()));

        assertEquals("w1", service.getWatch(KEY).orElseThrow().watchId());
    }

    @Test
    @DisplayName("Cancelling stops the remote watch and clears persisted state")
    void shouldCancelPersistedWatch() {
        store.save(new WatchRegistration("gmail", "projects/p/topics/t", "mailflow", "w1",
            Instant.parse("2030-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:00:00Z"), false, Map.of()));

        assertTrue(service.cancelWatch(KEY));

        verify(mailbox).stopWatch();
        assertTrue(store.load(KEY).isEmpty());
    }

    @Test
    @DisplayName("Cancelling without persisted state still stops the remote watch")
    void shouldCancelWithoutState() {
        assertFalse(service.cancelWatch(KEY));

        verify(mailbox).stopWatch();
    }
}
