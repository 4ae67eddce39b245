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
import me.golemcore.conductor.domain.model.ToolInvocationState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Liveness-based timeout supervision for running tool invocations.
 *
 * <p>
 * An invocation is registered with {@link #begin}, refreshed by
 * {@link #markProgress} and removed by {@link #finish}. The remaining time is
 * measured from the last progress, not from the start, so a tool that keeps
 * reporting output never times out while a silent one does after
 * {@code timeoutSeconds}.
 *
 * <p>
 * While the watchdog is paused the remaining time is undefined and no
 * invocation expires. The most recently begun invocation is tracked as the
 * active one for {@link #cancelActive()} and the countdown display.
 */
@Slf4j
public class ToolTimeoutWatchdog {

    public static final long DEFAULT_TIMEOUT_SECONDS = 120;
    public static final long MIN_TIMEOUT_SECONDS = 1;
    public static final long MAX_TIMEOUT_SECONDS = 600;
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);
    private static final long COUNTDOWN_THRESHOLD_SECONDS = 5;

    private final Clock clock;
    private final Duration pollInterval;
    private final Map<String, ToolInvocationState> invocations = new ConcurrentHashMap<>();
    private final Map<String, Runnable> cancelHooks = new ConcurrentHashMap<>();
    private volatile String activeToolCallId;
    private volatile boolean paused;
    private volatile Instant pausedAt;

    public ToolTimeoutWatchdog(Clock clock) {
        this(clock, DEFAULT_POLL_INTERVAL);
    }

    public ToolTimeoutWatchdog(Clock clock, Duration pollInterval) {
        this.clock = clock;
        this.pollInterval = pollInterval;
    }

    /**
     * Clamps a configured timeout into [1, 600] seconds. Zero or negative means
     * "not configured" and yields the default.
     */
    public static long resolveTimeoutSeconds(long configured) {
        if (configured <= 0) {
            return DEFAULT_TIMEOUT_SECONDS;
        }
        return Math.max(MIN_TIMEOUT_SECONDS, Math.min(MAX_TIMEOUT_SECONDS, configured));
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void begin(String toolCallId, String toolName, String targetFile, long timeoutSeconds) {
        Instant now = clock.instant();
        invocations.put(toolCallId,
                new ToolInvocationState(toolCallId, toolName, targetFile, now, now, timeoutSeconds, false));
        activeToolCallId = toolCallId;
        log.debug("[Watchdog] Begin {} ({}), timeout {}s", toolCallId, toolName, timeoutSeconds);
    }

    public void markProgress(String toolCallId) {
        invocations.computeIfPresent(toolCallId, (id, state) -> state.withProgress(clock.instant()));
    }

    /**
     * Registers a hook run when {@link #cancel} is requested for the invocation.
     * Used to propagate the cancel to the running tool body.
     */
    public void onCancel(String toolCallId, Runnable hook) {
        cancelHooks.put(toolCallId, hook);
        if (isCancelled(toolCallId)) {
            runCancelHook(toolCallId);
        }
    }

    public void cancel(String toolCallId) {
        ToolInvocationState updated = invocations.computeIfPresent(toolCallId, (id, state) -> state.withCancelled());
        if (updated == null) {
            log.debug("[Watchdog] Cancel ignored, no invocation {}", toolCallId);
            return;
        }
        log.info("[Watchdog] Cancel requested for {} ({})", toolCallId, updated.toolName());
        runCancelHook(toolCallId);
    }

    /**
     * Cancels the most recently begun invocation, if any is still running.
     *
     * @return whether an invocation was cancelled
     */
    public boolean cancelActive() {
        String toolCallId = activeToolCallId;
        if (toolCallId == null || !invocations.containsKey(toolCallId)) {
            return false;
        }
        cancel(toolCallId);
        return true;
    }

    public boolean isCancelled(String toolCallId) {
        ToolInvocationState state = invocations.get(toolCallId);
        return state != null && state.cancelled();
    }

    /**
     * Whole seconds left before the invocation expires, rounded up. Empty when
     * the invocation is unknown or the watchdog is paused. May be zero or
     * negative once the deadline passed.
     */
    public OptionalLong remainingSeconds(String toolCallId) {
        if (paused) {
            return OptionalLong.empty();
        }
        ToolInvocationState state = invocations.get(toolCallId);
        if (state == null) {
            return OptionalLong.empty();
        }
        long remainingMillis = Duration.between(clock.instant(), state.deadline()).toMillis();
        return OptionalLong.of(Math.floorDiv(remainingMillis + 999, 1000));
    }

    public void finish(String toolCallId) {
        invocations.remove(toolCallId);
        cancelHooks.remove(toolCallId);
        if (toolCallId.equals(activeToolCallId)) {
            activeToolCallId = null;
        }
        log.debug("[Watchdog] Finish {}", toolCallId);
    }

    /**
     * Toggles pause. The paused state is only changed here; starting or
     * finishing invocations leaves it alone. Resuming shifts every invocation's
     * last progress forward by the part of the pause it spent waiting, so time
     * spent paused is not counted.
     *
     * @return the new paused state
     */
    public synchronized boolean togglePause() {
        if (paused) {
            Instant now = clock.instant();
            Instant pauseStart = pausedAt;
            invocations.replaceAll((id, state) -> {
                Instant waitingSince = state.lastProgressAt().isAfter(pauseStart) ? state.lastProgressAt()
                        : pauseStart;
                return state.withProgress(state.lastProgressAt().plus(Duration.between(waitingSince, now)));
            });
            paused = false;
            pausedAt = null;
        } else {
            paused = true;
            pausedAt = clock.instant();
        }
        log.info("[Watchdog] {}", paused ? "Paused" : "Resumed");
        return paused;
    }

    public boolean isPaused() {
        return paused;
    }

    public Optional<ToolInvocationState> activeInvocation() {
        String toolCallId = activeToolCallId;
        return toolCallId == null ? Optional.empty() : Optional.ofNullable(invocations.get(toolCallId));
    }

    /**
     * Countdown for the active invocation, present only in the last few seconds
     * before it expires.
     */
    public OptionalLong countdownSeconds() {
        String toolCallId = activeToolCallId;
        if (toolCallId == null) {
            return OptionalLong.empty();
        }
        OptionalLong remaining = remainingSeconds(toolCallId);
        if (remaining.isPresent() && remaining.getAsLong() > 0
                && remaining.getAsLong() <= COUNTDOWN_THRESHOLD_SECONDS) {
            return remaining;
        }
        return OptionalLong.empty();
    }

    /**
     * One supervision check for a running invocation.
     *
     * @throws ToolCancelledException
     *             when a cancel was requested
     * @throws ToolTimeoutException
     *             when the liveness deadline passed
     */
    public void check(String toolCallId) {
        ToolInvocationState state = invocations.get(toolCallId);
        if (state == null) {
            return;
        }
        if (state.cancelled()) {
            throw new ToolCancelledException(state.toolName());
        }
        OptionalLong remaining = remainingSeconds(toolCallId);
        if (remaining.isPresent() && remaining.getAsLong() <= 0) {
            log.warn("[Watchdog] {} ({}) timed out after {}s without progress", toolCallId, state.toolName(),
                    state.timeoutSeconds());
            throw new ToolTimeoutException(state.toolName(), state.timeoutSeconds());
        }
    }

    private void runCancelHook(String toolCallId) {
        Runnable hook = cancelHooks.remove(toolCallId);
        if (hook != null) {
            hook.run();
        }
    }
}
