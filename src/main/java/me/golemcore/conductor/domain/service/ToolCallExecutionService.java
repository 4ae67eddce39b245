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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.component.ProgressReportingToolComponent;
import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.RuntimeEventType;
import me.golemcore.conductor.domain.model.ToolArguments;
import me.golemcore.conductor.domain.model.ToolFailureKind;
import me.golemcore.conductor.domain.model.ToolResult;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.domain.support.CancellationToken;
import me.golemcore.conductor.port.outbound.ConversationLogPort;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Executes batches of tool calls: name resolution, argument merging,
 * scheduling, timeout supervision, result classification and truncation.
 *
 * <p>
 * Every call of a batch yields exactly one terminal result, returned in
 * request order. Progress (the initial "Executing" message, streamed output
 * snapshots and the terminal message) is pushed to the caller's progress
 * consumer. Does NOT mutate conversation history itself.
 *
 * <p>
 * Batch tasks run on {@code batchExecutor} where they wait for admission by
 * the {@link ToolScheduler}; tool bodies run on {@code bodyExecutor} and race
 * the {@link ToolTimeoutWatchdog} poll loop. The two pools are separate so a
 * waiting batch task never starves a body of threads.
 */
@Slf4j
public class ToolCallExecutionService {

    static final String TOOL_NOT_FOUND = "Tool not found";
    static final String CANCELLED_BY_USER = "Cancelled by user";
    private static final String READ_FAILURE_HINT = "Hint: do not guess filenames. First list or search the "
            + "project files to discover the correct path, then call %s with that exact path.";

    private final ToolScheduler scheduler;
    private final ToolTimeoutWatchdog watchdog;
    private final ToolNameResolver nameResolver;
    private final ToolArgumentResolver argumentResolver;
    private final ToolChangePreviewBuilder previewBuilder;
    private final ToolResultMessageFactory messageFactory;
    private final RuntimeEventService runtimeEventService;
    private final ConversationLogPort conversationLog;
    private final ExecutorService batchExecutor;
    private final ExecutorService bodyExecutor;
    private final long timeoutSeconds;
    private final int maxToolResultChars;

    public ToolCallExecutionService(ToolScheduler scheduler,
            ToolTimeoutWatchdog watchdog,
            ToolNameResolver nameResolver,
            ToolArgumentResolver argumentResolver,
            ToolChangePreviewBuilder previewBuilder,
            ToolResultMessageFactory messageFactory,
            RuntimeEventService runtimeEventService,
            ConversationLogPort conversationLog,
            ExecutorService batchExecutor,
            ExecutorService bodyExecutor,
            long configuredTimeoutSeconds,
            int maxToolResultChars) {
        this.scheduler = scheduler;
        this.watchdog = watchdog;
        this.nameResolver = nameResolver;
        this.argumentResolver = argumentResolver;
        this.previewBuilder = previewBuilder;
        this.messageFactory = messageFactory;
        this.runtimeEventService = runtimeEventService;
        this.conversationLog = conversationLog;
        this.batchExecutor = batchExecutor;
        this.bodyExecutor = bodyExecutor;
        this.timeoutSeconds = ToolTimeoutWatchdog.resolveTimeoutSeconds(configuredTimeoutSeconds);
        this.maxToolResultChars = maxToolResultChars;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public ToolTimeoutWatchdog getWatchdog() {
        return watchdog;
    }

    /**
     * Executes all calls concurrently under the scheduler's policy.
     *
     * @return one terminal result per call, in request order
     */
    public List<ToolCallExecutionResult> executeBatch(List<Message.ToolCall> toolCalls, TurnContext context,
            Consumer<Message> onProgress) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            return List.of();
        }
        Consumer<Message> progress = onProgress != null ? onProgress : message -> {
        };

        Map<String, String> firstIdBySignature = new HashMap<>();
        List<CompletableFuture<ToolCallExecutionResult>> futures = new ArrayList<>(toolCalls.size());
        for (Message.ToolCall toolCall : toolCalls) {
            PreparedCall call = prepare(toolCall, context);
            String firstId = firstIdBySignature.putIfAbsent(signature(call.toolName(), toolCall), toolCall.getId());
            if (firstId != null) {
                log.debug("[Tools] Skipping duplicate call {} ({}), same as {}", toolCall.getId(),
                        toolCall.getName(), firstId);
                ToolCallExecutionResult skipped = terminalFailure(call, ToolFailureKind.DUPLICATE_SKIPPED,
                        "Duplicate tool call skipped (same as " + firstId + ")");
                progress.accept(skipped.message());
                futures.add(CompletableFuture.completedFuture(skipped));
                continue;
            }

            progress.accept(messageFactory.executing(toolCall, call.targetFile(),
                    "Executing " + toolCall.getName() + "...", call.preview()));
            futures.add(CompletableFuture.supplyAsync(() -> executeScheduled(call, context, progress), batchExecutor));
        }

        List<ToolCallExecutionResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ToolCallExecutionResult> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    /**
     * Resolves the tool once; scheduling, argument merging and the preview all
     * use the resolved name, so an alias is classified like its target.
     */
    private PreparedCall prepare(Message.ToolCall toolCall, TurnContext context) {
        ToolComponent tool = nameResolver.resolve(toolCall.getName(), context.getAvailableTools()).orElse(null);
        String toolName = tool != null ? tool.getToolName() : toolCall.getName();
        String targetFile = argumentResolver.resolveTargetFile(toolCall, toolName).orElse(null);
        ToolArguments arguments = argumentResolver.mergeArguments(toolCall, toolName, context.getConversationId());
        String preview = previewBuilder.build(toolName, arguments).orElse(null);
        return new PreparedCall(toolCall, tool, toolName, targetFile, arguments, preview);
    }

    private ToolCallExecutionResult executeScheduled(PreparedCall call, TurnContext context,
            Consumer<Message> progress) {
        try {
            if (argumentResolver.isWriteLikeTool(call.toolName())) {
                return scheduler.runWrite(
                        argumentResolver.pathKey(call.toolCall(), call.toolName(), context.getProjectRoot()),
                        () -> executeToolCall(call, context, progress));
            }
            return scheduler.runRead(() -> executeToolCall(call, context, progress));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ToolCallExecutionResult cancelled = terminalFailure(call, ToolFailureKind.CANCELLED,
                    "Error: " + CANCELLED_BY_USER);
            progress.accept(cancelled.message());
            return cancelled;
        } catch (Exception e) { // NOSONAR - every call must end with a terminal result
            log.error("[Tools] Scheduling failed: {}", call.toolCall().getName(), e);
            ToolCallExecutionResult failed = terminalFailure(call, ToolFailureKind.EXECUTION_FAILED,
                    "Error: " + safeCauseMessage(e));
            progress.accept(failed.message());
            return failed;
        }
    }

    private ToolCallExecutionResult executeToolCall(PreparedCall call, TurnContext context,
            Consumer<Message> progress) {
        Message.ToolCall toolCall = call.toolCall();
        logEvent(context, "tool.execute_start", toolCall, Map.of("targetFile", nullToEmpty(call.targetFile())));
        runtimeEventService.emit(context, RuntimeEventType.TOOL_STARTED,
                Map.of("toolCallId", toolCall.getId(), "tool", toolCall.getName()));

        ToolCallExecutionResult result = resolveAndExecute(call, context, progress);

        runtimeEventService.emit(context, RuntimeEventType.TOOL_FINISHED, Map.of(
                "toolCallId", toolCall.getId(),
                "tool", toolCall.getName(),
                "success", result.toolResult().isSuccess()));
        progress.accept(result.message());
        return result;
    }

    private ToolCallExecutionResult resolveAndExecute(PreparedCall call, TurnContext context,
            Consumer<Message> progress) {
        Message.ToolCall toolCall = call.toolCall();
        ToolComponent tool = call.tool();
        if (tool == null) {
            log.warn("[Tools] Tool not found: {}", toolCall.getName());
            logEvent(context, "tool.not_found", toolCall, Map.of());
            return terminalFailure(call, ToolFailureKind.NOT_FOUND, TOOL_NOT_FOUND);
        }
        if (!tool.isEnabled()) {
            return terminalFailure(call, ToolFailureKind.POLICY_DENIED, "Tool is disabled: " + tool.getToolName());
        }
        if (isCancelled(context, toolCall.getId())) {
            return terminalFailure(call, ToolFailureKind.CANCELLED, "Error: " + CANCELLED_BY_USER);
        }

        String toolCallId = toolCall.getId();
        CancellationToken token = context.getCancellation().child();

        watchdog.begin(toolCallId, call.toolName(), call.targetFile(), timeoutSeconds);
        watchdog.onCancel(toolCallId, () -> token.cancel(CANCELLED_BY_USER));
        try {
            String output = runSupervised(call, token, context, progress);
            if (output == null || output.isBlank()) {
                throw ToolExecutionCrashException.emptyResponse();
            }
            logEvent(context, "tool.execute_success", toolCall, Map.of("outputLength", output.length()));
            String content = truncateToolResult(output, toolCall.getName());
            return new ToolCallExecutionResult(toolCallId, toolCall.getName(), ToolResult.success(output),
                    messageFactory.completed(toolCall, call.targetFile(), content, call.preview()));
        } catch (ToolTimeoutException e) {
            return failed(call, context, ToolFailureKind.TIMED_OUT, formatError(e, call.toolName()));
        } catch (ToolCancelledException | CancellationException e) {
            return failed(call, context, ToolFailureKind.CANCELLED, "Error: " + CANCELLED_BY_USER);
        } catch (ToolExecutionCrashException e) {
            return failed(call, context, ToolFailureKind.EMPTY_RESPONSE, formatError(e, call.toolName()));
        } catch (Exception e) { // NOSONAR - tool failures become failed results
            log.error("[Tools] Tool execution failed: {}", toolCall.getName(), e);
            return failed(call, context, ToolFailureKind.EXECUTION_FAILED, formatError(e, call.toolName()));
        } finally {
            watchdog.finish(toolCallId);
        }
    }

    private String runSupervised(PreparedCall call, CancellationToken token, TurnContext context,
            Consumer<Message> progress) throws Exception {
        Message.ToolCall toolCall = call.toolCall();
        String toolCallId = toolCall.getId();
        Future<String> future = bodyExecutor.submit(() -> invoke(call, token, context, progress));
        long pollMillis = watchdog.getPollInterval().toMillis();
        try {
            while (true) {
                try {
                    return future.get(pollMillis, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (isCancelled(context, toolCall.getId())) {
                        throw new ToolCancelledException(toolCall.getName());
                    }
                    watchdog.check(toolCallId);
                }
            }
        } catch (ToolTimeoutException | ToolCancelledException e) {
            token.cancel(e.getMessage());
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel(CANCELLED_BY_USER);
            future.cancel(true);
            throw new ToolCancelledException(toolCall.getName());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw new IllegalStateException("Tool body failed: " + toolCall.getName(), cause);
        }
    }

    private String invoke(PreparedCall call, CancellationToken token, TurnContext context,
            Consumer<Message> progress) throws Exception {
        Message.ToolCall toolCall = call.toolCall();
        ToolArguments arguments = call.arguments();
        if (call.tool() instanceof ProgressReportingToolComponent streaming) {
            StringBuilder accumulated = new StringBuilder();
            return streaming.execute(arguments, token, chunk -> {
                if (chunk == null) {
                    return;
                }
                String snapshot;
                synchronized (accumulated) {
                    accumulated.append(chunk);
                    snapshot = accumulated.toString();
                }
                watchdog.markProgress(toolCall.getId());
                logEvent(context, "tool.execute_progress", toolCall, Map.of(
                        "chunkLength", chunk.length(), "totalLength", snapshot.length()));
                progress.accept(messageFactory.executing(toolCall, call.targetFile(),
                        truncateToolResult(snapshot, toolCall.getName()), call.preview()));
            });
        }
        return call.tool().execute(arguments, token);
    }

    private ToolCallExecutionResult failed(PreparedCall call, TurnContext context, ToolFailureKind kind,
            String message) {
        logEvent(context, "tool.execute_error", call.toolCall(), Map.of("kind", kind.name(), "error", message));
        if (kind == ToolFailureKind.TIMED_OUT || kind == ToolFailureKind.CANCELLED) {
            log.warn("[Tools] {} {}: {}", call.toolCall().getName(), kind, message);
        }
        return terminalFailure(call, kind, message);
    }

    private ToolCallExecutionResult terminalFailure(PreparedCall call, ToolFailureKind kind, String message) {
        Message.ToolCall toolCall = call.toolCall();
        return new ToolCallExecutionResult(toolCall.getId(), toolCall.getName(), ToolResult.failure(kind, message),
                messageFactory.failed(toolCall, call.targetFile(), message, call.preview()));
    }

    static String formatError(Throwable error, String toolName) {
        String message = safeCauseMessage(error);
        if (("index_read_file".equals(toolName) || "read_file".equals(toolName))
                && message.toLowerCase(Locale.ROOT).startsWith("file not found")) {
            return "Error: " + message + "\n\n" + String.format(READ_FAILURE_HINT, toolName);
        }
        return "Error: " + message;
    }

    static String safeCauseMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Truncate tool result content that exceeds the configured max length.
     */
    public String truncateToolResult(String content, String toolName) {
        if (content == null) {
            return null;
        }
        if (maxToolResultChars <= 0 || content.length() <= maxToolResultChars) {
            return content;
        }

        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxToolResultChars + " chars. Try a more specific query or process the data in smaller chunks.]";
        int cutPoint = Math.max(0, maxToolResultChars - suffix.length());
        log.warn("[Tools] Truncating '{}' result: {} chars -> ~{} chars",
                toolName, content.length(), cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    /**
     * Name plus canonical arguments (object keys sorted at every level,
     * correlation fields ignored).
     */
    static String signature(Message.ToolCall toolCall) {
        return signature(toolCall.getName(), toolCall);
    }

    static String signature(String toolName, Message.ToolCall toolCall) {
        return toolName + ":" + canonical(toolCall.argumentsOrEmpty());
    }

    private static String canonical(JsonNode node) {
        return switch (node.getNodeType()) {
        case OBJECT -> {
            Map<String, String> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getKey().startsWith("_")) {
                    sorted.put(field.getKey(), canonical(field.getValue()));
                }
            }
            yield sorted.toString();
        }
        case ARRAY -> {
            List<String> items = new ArrayList<>();
            node.elements().forEachRemaining(item -> items.add(canonical(item)));
            yield items.toString();
        }
        case STRING, NUMBER, BOOLEAN, BINARY, POJO -> node.toString();
        case NULL, MISSING -> "null";
        };
    }

    private void logEvent(TurnContext context, String type, Message.ToolCall toolCall, Map<String, Object> extra) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("toolCallId", toolCall.getId());
        data.put("tool", toolCall.getName());
        data.putAll(extra);
        conversationLog.append(context.getProjectRoot(), context.getConversationId(), type, data);
    }

    private static boolean isCancelled(TurnContext context, String toolCallId) {
        return context.getCancellation().isCancelled() || context.getCancelledToolCallIds().contains(toolCallId);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * A call after tool resolution. {@code tool} is null when no available tool
     * matches.
     */
    private record PreparedCall(Message.ToolCall toolCall, ToolComponent tool, String toolName, String targetFile,
            ToolArguments arguments, String preview) {
    }
}
