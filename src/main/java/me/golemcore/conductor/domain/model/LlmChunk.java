package me.golemcore.conductor.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Incremental piece of a streamed backend response.
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private boolean done;
    private LlmUsage usage;
}
