package com.mailflow.application.service;

import com.mailflow.application.port.out.MailboxClient;
import com.mailflow.application.port.out.MailboxClient.MessagePage;
import com.mailflow.domain.model.HistoryEntry;
import com.mailflow.domain.model.HistoryPage;
import com.mailflow.domain.model.MailFilter;
import com.mailflow.domain.model.MailRecord;
import com.mailflow.domain.model.Page;
import com.mailflow.infrastructure.exception.MailboxAuthorizationException;
import com.mailflow.infrastructure.exception.MailboxException;
import com.mailflow.support.MailFixtures;
import com.mailflow.support.RecordingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MailFetchService")
class MailFetchServiceTest {

    @Mock
    private MailboxClient mailbox;

    private MailFetchService service;

    @BeforeEach
    void setUp() {
        service = new MailFetchService(mailbox, new HistoryResolver(mailbox, new RecordingMetrics()));
    }

    @Nested
    @DisplayName("fetch")
    class FetchTests {

        @Test
        @DisplayName("Should return the listed messages with the continuation token")
        void shouldFetchPage() {
            MailFilter filter = MailFilter.builder().query("is:unread").build();
            when(mailbox.listMessages(filter)).thenReturn(new MessagePage(List.of("m1", "m2"), "next-page"));
            when(mailbox.getMessage("m1")).thenReturn(MailFixtures.record("m1", 10));
            when(mailbox.getMessage("m2")).thenReturn(MailFixtures.record("m2", 11));

            Page<MailRecord> page = service.fetch(filter);

            assertEquals(List.of("m1", "m2"), page.data().stream().map(MailRecord::id).toList());
            assertEquals("next-page", page.nextPageToken());
            assertTrue(page.hasMore());
        }

        @Test
        @DisplayName("Should skip a message that cannot be fetched")
        void shouldSkipFailedMessage() {
            when(mailbox.listMessages(MailFilter.DEFAULT)).thenReturn(new MessagePage(List.of("gone", "m2"), null));
            when(mailbox.getMessage("gone")).thenThrow(new MailboxException("404"));
            when(mailbox.getMessage("m2")).thenReturn(MailFixtures.record("m2", 11));

            Page<MailRecord> page = service.fetch(MailFilter.DEFAULT);

            assertEquals(1, page.data().size());
            assertFalse(page.hasMore());
        }

        @Test
        @DisplayName("Should fail on an authorization error")
        void shouldPropagateAuthorizationFailure() {
            when(mailbox.listMessages(MailFilter.DEFAULT)).thenReturn(new MessagePage(List.of("m1"), null));
            when(mailbox.getMessage("m1")).thenThrow(new MailboxAuthorizationException("revoked"));

            assertThrows(MailboxAuthorizationException.class, () -> service.fetch(MailFilter.DEFAULT));
        }
    }

    @Test
    @DisplayName("fetchSince returns the matching messages added after the history id")
    void shouldFetchSinceHistoryId() {
        MailFilter filter = MailFilter.builder().fromEmail("alice").build();
        when(mailbox.listHistory(100, null)).thenReturn(new HistoryPage(List.of(
            new HistoryEntry(101, List.of("a")),
            new HistoryEntry(102, List.of("b"))), null, 102));
        when(mailbox.getMessage("a")).thenReturn(MailFixtures.record("a", 101, "alice@x.com", "s", List.of()));
        when(mailbox.getMessage("b")).thenReturn(MailFixtures.record("b", 102, "bob@x.com", "s", List.of()));

        List<MailRecord> records = service.fetchSince(100, filter);

        assertEquals(List.of("a"), records.stream().map(MailRecord::id).toList());
    }
}
