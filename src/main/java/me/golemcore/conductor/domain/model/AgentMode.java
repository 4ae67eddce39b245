package me.golemcore.conductor.domain.model;

/**
 * Interaction mode of a conversation turn. Agent mode is expected to act
 * through tools; chat mode answers conversationally and gets a lower tool
 * iteration cap.
 */
public enum AgentMode {
    CHAT, AGENT
}
