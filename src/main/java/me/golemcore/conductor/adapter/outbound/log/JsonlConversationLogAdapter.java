package me.golemcore.conductor.adapter.outbound.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.port.outbound.ConversationLogPort;
import me.golemcore.conductor.port.outbound.ProjectStoragePort;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Writes conversation events as newline-delimited JSON, one file per
 * conversation under {@code <projectRoot>/<logDirectory>/<id>.ndjson}.
 */
@Slf4j
public class JsonlConversationLogAdapter implements ConversationLogPort {

    private final ProjectStoragePort storage;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String logDirectory;

    public JsonlConversationLogAdapter(ProjectStoragePort storage, ObjectMapper objectMapper, Clock clock,
            String logDirectory) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.logDirectory = logDirectory;
    }

    @Override
    public void append(String projectRoot, String conversationId, String type, Map<String, Object> data) {
        if (projectRoot == null || conversationId == null) {
            log.trace("[Runtime] Skipping log event {} without project or conversation", type);
            return;
        }
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("ts", clock.instant().toString());
        event.put("conversationId", conversationId);
        event.put("type", type);
        if (data != null && !data.isEmpty()) {
            event.put("data", data);
        }
        try {
            String line = objectMapper.writeValueAsString(event) + "\n";
            storage.appendText(projectRoot, logDirectory + "/" + conversationId + ".ndjson", line).join();
        } catch (JsonProcessingException | CompletionException | IllegalArgumentException e) {
            log.warn("[Runtime] Failed to append conversation event {}: {}", type, e.getMessage());
        }
    }
}
