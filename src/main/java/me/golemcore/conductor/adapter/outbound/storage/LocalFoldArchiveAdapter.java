package me.golemcore.conductor.adapter.outbound.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.FoldIndexEntry;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.port.outbound.FoldArchivePort;
import me.golemcore.conductor.port.outbound.ProjectStoragePort;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Stores folded transcript text as {@code <foldDirectory>/<id>.txt} and keeps
 * a JSON index of {id, summary, createdAt} in
 * {@code <foldDirectory>/index.json}.
 */
@Slf4j
public class LocalFoldArchiveAdapter implements FoldArchivePort {

    static final String INDEX_FILE = "index.json";
    private static final String MESSAGE_SEPARATOR = "\n\n---\n\n";
    private static final TypeReference<List<FoldIndexEntry>> INDEX_TYPE = new TypeReference<>() {
    };

    private final ProjectStoragePort storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String foldDirectory;
    private final ReentrantLock indexLock = new ReentrantLock();

    public LocalFoldArchiveAdapter(ProjectStoragePort storage, ObjectMapper objectMapper, Clock clock,
            String foldDirectory) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.foldDirectory = foldDirectory;
    }

    @Override
    public String archive(String projectRoot, String conversationId, List<Message> foldedMessages, String summary) {
        String id = UUID.randomUUID().toString();
        Instant createdAt = clock.instant();
        storage.putText(projectRoot, contentPath(id), serialize(foldedMessages, createdAt)).join();

        indexLock.lock();
        try {
            List<FoldIndexEntry> entries = new ArrayList<>(readIndex(projectRoot));
            entries.add(new FoldIndexEntry(id, summary, createdAt));
            storage.putText(projectRoot, indexPath(), objectMapper.writeValueAsString(entries)).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize fold index", e);
        } finally {
            indexLock.unlock();
        }
        log.debug("[History] Archived {} folded message(s) as {}", foldedMessages.size(), id);
        return id;
    }

    @Override
    public List<FoldIndexEntry> list(String projectRoot, int limit) {
        List<FoldIndexEntry> entries = readIndex(projectRoot);
        if (entries.size() <= limit) {
            return entries;
        }
        return List.copyOf(entries.subList(entries.size() - limit, entries.size()));
    }

    @Override
    public Optional<String> read(String projectRoot, String archiveId) {
        return Optional.ofNullable(storage.getText(projectRoot, contentPath(archiveId)).join());
    }

    static String serialize(List<Message> messages, Instant fallback) {
        List<String> blocks = new ArrayList<>();
        for (Message message : messages) {
            Instant timestamp = message.getTimestamp() != null ? message.getTimestamp() : fallback;
            StringBuilder block = new StringBuilder()
                    .append('[').append(DateTimeFormatter.ISO_INSTANT.format(timestamp)).append("] ")
                    .append(message.getRole() != null ? message.getRole().toUpperCase(Locale.ROOT) : "UNKNOWN");
            if (message.getContent() != null && !message.getContent().isEmpty()) {
                block.append('\n').append(message.getContent());
            }
            blocks.add(block.toString());
        }
        return String.join(MESSAGE_SEPARATOR, blocks);
    }

    private List<FoldIndexEntry> readIndex(String projectRoot) {
        String raw = storage.getText(projectRoot, indexPath()).join();
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(raw, INDEX_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[History] Fold index is unreadable, starting a new one: {}", e.getOriginalMessage());
            return List.of();
        }
    }

    private String contentPath(String id) {
        return foldDirectory + "/" + id + ".txt";
    }

    private String indexPath() {
        return foldDirectory + "/" + INDEX_FILE;
    }
}
