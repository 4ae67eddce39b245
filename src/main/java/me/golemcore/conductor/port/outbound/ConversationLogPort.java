package me.golemcore.conductor.port.outbound;

import java.util.Map;

/**
 * Append-only structured event log for a conversation. Implementations must
 * never throw: a failed write is logged and dropped.
 */
public interface ConversationLogPort {

    void append(String projectRoot, String conversationId, String type, Map<String, Object> data);
}
