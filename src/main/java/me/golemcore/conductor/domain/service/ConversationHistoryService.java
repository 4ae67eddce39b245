package me.golemcore.conductor.domain.service;


/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ToolExecutionStatus;
import me.golemcore.conductor.port.outbound.ProjectStoragePort;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sole owner of the transcript. Every mutation (appends from the tool loop,
 * executing snapshots from tool progress callbacks, fold replacements) goes
 * through this service under one lock, so readers always see a consistent
 * sequence.
 *
 * <p>
 * Also owns the conversation id. The id is persisted in the project (see
 * {@code conductor.conversation.id-file}) so reopening a project resumes the
 * same conversation log; persistence is best-effort.
 */
@Slf4j
public class ConversationHistoryService {

    private final ProjectStoragePort storage;
    private final Clock clock;
    private final String idFile;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Message> messages = new ArrayList<>();

    private String conversationId = UUID.randomUUID().toString();
    private String projectRoot;

    public ConversationHistoryService(ProjectStoragePort storage, Clock clock, String idFile) {
        this.storage = storage;
        this.clock = clock;
        this.idFile = idFile;
    }

    /** Previous and new id after {@link #startNewConversation()}. */
    public record ConversationRotation(String previousConversationId, String newConversationId) {
    }

    /**
     * Binds the history to a project root, resuming its persisted conversation id
     * or persisting the current one.
     */
    public void openProject(String root) {
        lock.lock();
        try {
            this.projectRoot = root;
            Optional<String> persisted = loadPersistedConversationId(root);
            if (persisted.isPresent()) {
                conversationId = persisted.get();
                log.info("[History] Resumed conversation {} for {}", conversationId, root);
            } else {
                persistConversationId(root, conversationId);
            }
        } finally {
            lock.unlock();
        }
    }

    public String getConversationId() {
        lock.lock();
        try {
            return conversationId;
        } finally {
            lock.unlock();
        }
    }

    public String getProjectRoot() {
        lock.lock();
        try {
            return projectRoot;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of the transcript, oldest first.
     */
    public List<Message> getMessages() {
        lock.lock();
        try {
            return List.copyOf(messages);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return messages.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a message. Assistant messages without content, reasoning or tool
     * calls are dropped.
     */
    public void append(Message message) {
        if (isEmptyAssistant(message)) {
            log.debug("[History] Skipping empty assistant message");
            return;
        }
        lock.lock();
        try {
            messages.add(stamp(message));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the latest tool message with the same tool-call id, or appends when
     * there is none. Executing snapshots of one call therefore occupy a single
     * slot that ends in the terminal state.
     */
    public void upsertToolExecutionMessage(Message message) {
        lock.lock();
        try {
            int index = lastToolMessageIndex(message.getToolCallId());
            if (index >= 0) {
                messages.set(index, stamp(message));
            } else {
                messages.add(stamp(message));
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Updates status (and optionally content) of the latest tool message for the
     * call in place.
     *
     * @return whether a message was updated
     */
    public boolean updateMessageStatus(String toolCallId, ToolExecutionStatus status, String content) {
        lock.lock();
        try {
            int index = lastToolMessageIndex(toolCallId);
            if (index < 0) {
                return false;
            }
            Message current = messages.get(index);
            messages.set(index, current.toBuilder()
                    .toolStatus(status)
                    .content(content != null ? content : current.getContent())
                    .build());
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Message> findToolMessage(String toolCallId) {
        lock.lock();
        try {
            int index = lastToolMessageIndex(toolCallId);
            return index >= 0 ? Optional.of(messages.get(index)) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public void removeOldestMessages(int count) {
        lock.lock();
        try {
            messages.subList(0, Math.min(Math.max(count, 0), messages.size())).clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the {@code count} oldest messages with a single message.
     */
    public void replaceOldestMessages(int count, Message replacement) {
        lock.lock();
        try {
            messages.subList(0, Math.min(Math.max(count, 0), messages.size())).clear();
            messages.add(0, stamp(replacement));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rotates the conversation id, persists it and clears the transcript.
     */
    public ConversationRotation startNewConversation() {
        lock.lock();
        try {
            String previous = conversationId;
            conversationId = UUID.randomUUID().toString();
            if (projectRoot != null) {
                persistConversationId(projectRoot, conversationId);
            }
            messages.clear();
            log.info("[History] Started conversation {} (was {})", conversationId, previous);
            return new ConversationRotation(previous, conversationId);
        } finally {
            lock.unlock();
        }
    }

    private int lastToolMessageIndex(String toolCallId) {
        if (toolCallId == null) {
            return -1;
        }
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message candidate = messages.get(i);
            if (candidate.isToolMessage() && toolCallId.equals(candidate.getToolCallId())) {
                return i;
            }
        }
        return -1;
    }

    private Message stamp(Message message) {
        Message.MessageBuilder builder = message.toBuilder();
        if (message.getId() == null) {
            builder.id(UUID.randomUUID().toString());
        }
        if (message.getTimestamp() == null) {
            builder.timestamp(clock.instant());
        }
        return builder.build();
    }

    private static boolean isEmptyAssistant(Message message) {
        return message.isAssistantMessage()
                && isBlank(message.getContent())
                && isBlank(message.getReasoning())
                && !message.hasToolCalls();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private Optional<String> loadPersistedConversationId(String root) {
        if (root == null) {
            return Optional.empty();
        }
        try {
            String raw = storage.getText(root, idFile).join();
            if (raw == null || raw.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(raw.trim());
        } catch (RuntimeException e) {
            log.warn("[History] Failed to read conversation id from {}: {}", root, e.getMessage());
            return Optional.empty();
        }
    }

    private void persistConversationId(String root, String id) {
        if (root == null) {
            return;
        }
        try {
            storage.putText(root, idFile, id).join();
        } catch (RuntimeException e) {
            log.warn("[History] Failed to persist conversation id to {}: {}", root, e.getMessage());
        }
    }
}
