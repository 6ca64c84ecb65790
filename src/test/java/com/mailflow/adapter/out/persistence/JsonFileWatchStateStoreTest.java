package com.mailflow.adapter.out.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.domain.model.WatchKey;
import com.mailflow.domain.model.WatchRegistration;
import com.mailflow.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonFileWatchStateStore")
class JsonFileWatchStateStoreTest {

    @TempDir
    Path directory;

    private JsonFileWatchStateStore store;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.getWatch().setStateDirectory(directory.toString());
        store = new JsonFileWatchStateStore(new ObjectMapper(), appProperties);
    }

    private static WatchRegistration registration(boolean owned) {
        return new WatchRegistration(
            "Gmail",
            "projects/p/topics/t",
            "Inbox-Sync",
            "0190f3a0-0000-7000-8000-000000000001",
            Instant.parse("2024-03-17T12:00:00Z"),
            Instant.parse("2024-03-10T12:00:00Z"),
            owned,
            Map.of("historyId", "1234")
        );
    }

    @Nested
    @DisplayName("save")
    class SaveTests {

        @Test
        @DisplayName("Should write one lowercase file per service and application")
        void shouldWriteLowercaseFile() {
            // When
            store.save(registration(true));

            // Then
            Path file = directory.resolve("gmail-watch-inbox-sync.json");
            assertTrue(Files.exists(file));
            assertEquals(file, store.fileFor(new WatchKey("GMAIL", "inbox-sync")));
        }

        @Test
        @DisplayName("Should store timestamps as ISO-8601 and leave ownership out")
        void shouldWriteIsoTimestampsWithoutOwnership() throws Exception {
            // When
            store.save(registration(true));

            // Then
            String json = Files.readString(directory.resolve("gmail-watch-inbox-sync.json"));
            assertTrue(json.contains("\"expiration\" : \"2024-03-17T12:00:00Z\""));
            assertTrue(json.contains("\"createdAt\" : \"2024-03-10T12:00:00Z\""));
            assertFalse(json.contains("owned"));
        }

        @Test
        @DisplayName("Should remove the temporary file when the state file cannot be replaced")
        void shouldRemoveTemporaryFileOnFailure() throws Exception {
            // Given
            Path blocked = Files.createDirectory(directory.resolve("gmail-watch-inbox-sync.json"));
            Files.writeString(blocked.resolve("occupied"), "x");

            // When
            assertThrows(UncheckedIOException.class, () -> store.save(registration(true)));

            // Then
            try (Stream<Path> files = Files.list(directory)) {
                assertEquals(List.of(blocked), files.toList());
            }
        }

        @Test
        @DisplayName("Should replace an earlier registration")
        void shouldReplaceEarlierRegistration() {
            // Given
            store.save(registration(true));
            WatchRegistration renewed = new WatchRegistration("gmail", "projects/p/topics/t", "inbox-sync",
                "renewed", Instant.parse("2024-03-24T12:00:00Z"), Instant.parse("2024-03-17T11:00:00Z"), true, null);

            // When
            store.save(renewed);

            // Then
            WatchRegistration loaded = store.load(new WatchKey("gmail", "inbox-sync")).orElseThrow();
            assertEquals("renewed", loaded.watchId());
            assertEquals(Instant.parse("2024-03-24T12:00:00Z"), loaded.expiration());
        }
    }

    @Nested
    @DisplayName("load")
    class LoadTests {

        @Test
        @DisplayName("Should read back a saved registration as not owned")
        void shouldReadBackAsNotOwned() {
            // Given
            store.save(registration(true));

            // When
            Optional<WatchRegistration> loaded = store.load(new WatchKey("gmail", "inbox-sync"));

            // Then
            assertTrue(loaded.isPresent());
            assertEquals(registration(false), loaded.get());
        }

        @Test
        @DisplayName("Should return empty when no file exists")
        void shouldReturnEmptyWhenMissing() {
            assertTrue(store.load(new WatchKey("gmail", "nobody")).isEmpty());
        }

        @Test
        @DisplayName("Should treat a corrupt file as absent")
        void shouldTreatCorruptFileAsAbsent() throws Exception {
            // Given
            Files.writeString(directory.resolve("gmail-watch-inbox-sync.json"), "{not json");

            // When / Then
            assertTrue(store.load(new WatchKey("gmail", "inbox-sync")).isEmpty());
        }

        @Test
        @DisplayName("Should read a registration whose service data holds null values")
        void shouldReadNullServiceData() throws Exception {
            // Given
            Files.writeString(directory.resolve("gmail-watch-inbox-sync.json"),
                "{\"serviceType\":\"gmail\",\"applicationName\":\"inbox-sync\",\"watchId\":\"w-1\","
                    + "\"topicName\":\"projects/p/topics/t\",\"expiration\":\"2024-03-17T12:00:00Z\","
                    + "\"serviceSpecificData\":{\"historyId\":null,\"labelIds\":[\"INBOX\"]}}");

            // When
            Optional<WatchRegistration> loaded = store.load(new WatchKey("gmail", "inbox-sync"));

            // Then
            assertTrue(loaded.isPresent());
            Map<String, Object> data = loaded.get().serviceSpecificData();
            assertTrue(data.containsKey("historyId"));
            assertNull(data.get("historyId"));
            assertEquals(List.of("INBOX"), data.get("labelIds"));
        }

        @Test
        @DisplayName("Should treat an unparsable timestamp as absent")
        void shouldTreatBadTimestampAsAbsent() throws Exception {
            // Given
            Files.writeString(directory.resolve("gmail-watch-inbox-sync.json"),
                "{\"serviceType\":\"gmail\",\"applicationName\":\"inbox-sync\",\"expiration\":\"next week\"}");

            // When / Then
            assertTrue(store.load(new WatchKey("gmail", "inbox-sync")).isEmpty());
        }
    }

    @Test
    @DisplayName("Should delete the file on clear and tolerate a second clear")
    void shouldClear() {
        // Given
        store.save(registration(true));
        WatchKey key = new WatchKey("gmail", "inbox-sync");

        // When
        store.clear(key);
        store.clear(key);

        // Then
        assertFalse(Files.exists(directory.resolve("gmail-watch-inbox-sync.json")));
        assertTrue(store.load(key).isEmpty());
    }
}
