package me.golemcore.conductor.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token usage reported by the backend for a single call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmUsage {

    private Integer inputTokens;
    private Integer outputTokens;
    private Integer totalTokens;
}
