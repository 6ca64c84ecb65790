package com.mailflow.adapter.out.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.application.port.out.WatchStateStore;
import com.mailflow.domain.model.WatchKey;
import com.mailflow.domain.model.WatchRegistration;
import com.mailflow.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * One JSON file per key, named {@code {serviceType}-watch-{applicationName}.json}, under the
 * configured state directory. A file that cannot be read or parsed is treated as absent.
 */
@Component
public class JsonFileWatchStateStore implements WatchStateStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileWatchStateStore.class);

    private final ObjectMapper objectMapper;
    private final Path directory;

    public JsonFileWatchStateStore(ObjectMapper objectMapper, AppProperties appProperties) {
        this.objectMapper = objectMapper;
        String configured = appProperties.getWatch().getStateDirectory();
        this.directory = configured == null || configured.isBlank()
            ? Path.of(System.getProperty("user.home"), ".mailflow", "watch-state")
            : Path.of(configured);
    }

    @Override
    public Optional<WatchRegistration> load(WatchKey key) {
        Path file = fileFor(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            WatchStateDocument document = objectMapper.readValue(file.toFile(), WatchStateDocument.class);
            return Optional.of(document.toRegistration());
        } catch (IOException | RuntimeException e) {
            log.warn("Ignoring unreadable watch state {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(WatchRegistration registration) {
        Path file = fileFor(WatchKey.of(registration));
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter()
                .writeValue(temp.toFile(), WatchStateDocument.from(registration));
            move(temp, file);
            log.debug("Watch state saved: {}", file);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to save watch state " + file, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary watch state {}: {}", temp, e.getMessage());
        }
    }

    @Override
    public void clear(WatchKey key) {
        Path file = fileFor(key);
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Watch state cleared: {}", file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear watch state " + file, e);
        }
    }

    Path fileFor(WatchKey key) {
        return directory.resolve(key.serviceType() + "-watch-" + key.applicationName() + ".json");
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * On-disk form. Timestamps are ISO-8601 UTC strings; {@code owned} is not stored.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record WatchStateDocument(
        String serviceType,
        String watchId,
        String topicName,
        String applicationName,
        String expiration,
        String createdAt,
        Map<String, Object> serviceSpecificData
    ) {
        static WatchStateDocument from(WatchRegistration registration) {
            return new WatchStateDocument(
                registration.serviceType(),
                registration.watchId(),
                registration.topicName(),
                registration.applicationName(),
                registration.expiration() == null ? null : registration.expiration().toString(),
                registration.createdAt() == null ? null : registration.createdAt().toString(),
                registration.serviceSpecificData()
            );
        }

        WatchRegistration toRegistration() {
            return new WatchRegistration(
                serviceType,
                topicName,
                applicationName,
                watchId,
                expiration == null ? null : Instant.parse(expiration),
                createdAt == null ? null : Instant.parse(createdAt),
                false,
                serviceSpecificData
            );
        }
    }
}
