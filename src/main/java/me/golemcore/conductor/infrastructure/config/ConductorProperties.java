package me.golemcore.conductor.infrastructure.config;


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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code conductor.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - inference backend connection</li>
 * <li>{@link ToolsProperties} - tool timeout, read parallelism, result size</li>
 * <li>{@link ToolLoopProperties} - iteration caps of the single-pass loop</li>
 * <li>{@link OrchestrationProperties} - phase caps and verify allowlist</li>
 * <li>{@link FoldingProperties} - transcript folding thresholds</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "conductor")
@Data
public class ConductorProperties {

    private LlmProperties llm = new LlmProperties();
    private ToolsProperties tools = new ToolsProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private OrchestrationProperties orchestration = new OrchestrationProperties();
    private FoldingProperties folding = new FoldingProperties();
    private ConversationProperties conversation = new ConversationProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** OpenAI-compatible endpoint. Empty means the provider default. */
        private String baseUrl = "";
        /** Without an API key the no-op backend is used. */
        private String apiKey = "";
        private String model = "gpt-4o-mini";
        private int requestTimeoutSeconds = 120;
        private double temperature = 0.2;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        /**
         * Liveness timeout for a single tool invocation. Values outside [1, 600] are
         * clamped; zero or negative falls back to the default.
         */
        private int timeoutSeconds = 120;

        /** Permits of the read semaphore. */
        private int maxParallelReads = 4;

        /**
         * Max characters of tool output kept in a tool result message. Longer output
         * is truncated.
         */
        private int maxToolResultChars = 5000;

        /** Watchdog poll interval. */
        private long pollIntervalMillis = 200;

        /** Threads of the executor that runs tool bodies. */
        private int executorThreads = 8;
    }

    // ==================== TOOL LOOP ====================

    @Data
    public static class ToolLoopProperties {
        private int agentMaxIterations = 12;
        private int chatMaxIterations = 5;
    }

    // ==================== ORCHESTRATION ====================

    @Data
    public static class OrchestrationProperties {
        /** When enabled, agent-mode turns run the phased orchestrator. */
        private boolean enabled = false;
        private int maxWorkerIterations = 12;
        private int maxReviewIterations = 3;
        private int maxVerifyIterations = 3;
        private List<String> verifyAllowedPrefixes = new ArrayList<>(List.of(
                "xcodebuild ", "swift test", "swift-format ", "swiftlint ", "git status", "git diff", "git log"));
    }

    // ==================== FOLDING ====================

    @Data
    public static class FoldingProperties {
        private boolean enabled = true;
        private int maxMessages = 40;
        private int maxContentChars = 20000;
        /** Most recent messages kept verbatim after a fold. */
        private int preserveRecentMessages = 20;
    }

    // ==================== CONVERSATION ====================

    @Data
    public static class ConversationProperties {
        /** Project-relative file holding the persisted conversation id. */
        private String idFile = ".ide/chat/conversation_id.txt";
        /** Project-relative directory of the JSONL conversation logs. */
        private String logDirectory = ".ide/logs/conversations";
        /** Project-relative directory of the fold archives. */
        private String foldDirectory = ".ide/chat/folds";
    }
}
