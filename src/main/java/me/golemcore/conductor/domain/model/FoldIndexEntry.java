package me.golemcore.conductor.domain.model;

import java.time.Instant;

/**
 * One entry of the fold archive index.
 */
public record FoldIndexEntry(String id, String summary, Instant createdAt) {
}
