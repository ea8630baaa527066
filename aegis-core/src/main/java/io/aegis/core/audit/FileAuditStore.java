package io.aegis.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only JSON-lines log in {@code audit.log}. When the file grows past the size limit it
 * is rotated to {@code audit.log.1}, shifting older files up to {@code audit.log.(maxFiles-1)}.
 */
public final class FileAuditStore implements AuditStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileAuditStore.class);
    public static final String FILE_NAME = "audit.log";

    private final Path directory;
    private final Path path;
    private final long maxFileSizeBytes;
    private final int maxFiles;
    private final ObjectMapper mapper;

    public FileAuditStore(Path directory, long maxFileSizeBytes, int maxFiles) {
        if (maxFileSizeBytes <= 0 || maxFiles <= 0) {
            throw new IllegalArgumentException("maxFileSizeBytes and maxFiles must be positive");
        }
        this.directory = directory;
        this.path = directory.resolve(FILE_NAME);
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.maxFiles = maxFiles;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Oldest first, across the rotated files.
     */
    @Override
    public synchronized List<AuditEvent> load() throws IOException {
        List<AuditEvent> events = new ArrayList<>();
        for (int i = maxFiles - 1; i >= 0; i--) {
            Path file = fileAt(i);
            if (!Files.exists(file)) {
                continue;
            }
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    events.add(mapper.readValue(line, AuditEvent.class));
                } catch (IOException e) {
                    LOG.debug("Skipping unreadable audit line in {}: {}", file, e.getMessage());
                }
            }
        }
        return events;
    }

    @Override
    public synchronized void append(AuditEvent event) throws IOException {
        Files.createDirectories(directory);
        if (Files.exists(path) && Files.size(path) >= maxFileSizeBytes) {
            rotate();
        }
        String line = mapper.writeValueAsString(event) + System.lineSeparator();
        Files.writeString(path, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    public Path path() {
        return path;
    }

    private void rotate() throws IOException {
        if (maxFiles == 1) {
            Files.delete(path);
            return;
        }
        Files.deleteIfExists(fileAt(maxFiles - 1));
        for (int i = maxFiles - 2; i >= 1; i--) {
            Path source = fileAt(i);
            if (Files.exists(source)) {
                Files.move(source, fileAt(i + 1), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        Files.move(path, fileAt(1), StandardCopyOption.REPLACE_EXISTING);
        LOG.info("Rotated audit log {}", path);
    }

    private Path fileAt(int index) {
        return index == 0 ? path : directory.resolve(FILE_NAME + "." + index);
    }
}
