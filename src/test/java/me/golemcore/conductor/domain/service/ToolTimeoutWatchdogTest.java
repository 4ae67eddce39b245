package me.golemcore.conductor.domain.service;

import me.golemcore.conductor.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolTimeoutWatchdogTest {

    private static final String CALL_ID = "call_1";

    private MutableClock clock;
    private ToolTimeoutWatchdog watchdog;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-14T00:00:00Z"));
        watchdog = new ToolTimeoutWatchdog(clock);
    }

    // ==================== resolveTimeoutSeconds ====================

    @Test
    void shouldClampConfiguredTimeout() {
        assertEquals(ToolTimeoutWatchdog.DEFAULT_TIMEOUT_SECONDS, ToolTimeoutWatchdog.resolveTimeoutSeconds(0));
        assertEquals(ToolTimeoutWatchdog.DEFAULT_TIMEOUT_SECONDS, ToolTimeoutWatchdog.resolveTimeoutSeconds(-5));
        assertEquals(1, ToolTimeoutWatchdog.resolveTimeoutSeconds(1));
        assertEquals(45, ToolTimeoutWatchdog.resolveTimeoutSeconds(45));
        assertEquals(600, ToolTimeoutWatchdog.resolveTimeoutSeconds(9000));
    }

    // ==================== liveness ====================

    @Test
    void shouldNeverTimeOutWhileProgressKeepsArriving() {
        watchdog.begin(CALL_ID, "run_command", null, 2);

        for (int i = 0; i < 20; i++) {
            clock.advance(Duration.ofMillis(1500));
            watchdog.markProgress(CALL_ID);
            assertDoesNotThrow(() -> watchdog.check(CALL_ID));
        }
    }

    @Test
    void shouldTimeOutWhenNoProgressWithinWindow() {
        watchdog.begin(CALL_ID, "run_command", null, 2);
        clock.advance(Duration.ofMillis(1999));
        assertDoesNotThrow(() -> watchdog.check(CALL_ID));

        clock.advance(Duration.ofMillis(1));
        ToolTimeoutException exception = assertThrows(ToolTimeoutException.class, () -> watchdog.check(CALL_ID));

        assertEquals(2, exception.getTimeoutSeconds());
        assertTrue(exception.getMessage().contains("2 seconds"));
    }

    @Test
    void shouldRoundRemainingSecondsUp() {
        watchdog.begin(CALL_ID, "read_file", null, 10);
        clock.advance(Duration.ofMillis(2500));

        assertEquals(OptionalLong.of(8), watchdog.remainingSeconds(CALL_ID));
        assertEquals(OptionalLong.empty(), watchdog.remainingSeconds("unknown"));
    }

    // ==================== cancellation ====================

    @Test
    void shouldRunCancelHookAndFailCheck() {
        AtomicBoolean hookRan = new AtomicBoolean();
        watchdog.begin(CALL_ID, "run_command", null, 30);
        watchdog.onCancel(CALL_ID, () -> hookRan.set(true));

        watchdog.cancel(CALL_ID);

        assertTrue(hookRan.get());
        assertTrue(watchdog.isCancelled(CALL_ID));
        assertThrows(ToolCancelledException.class, () -> watchdog.check(CALL_ID));
    }

    @Test
    void shouldRunHookImmediatelyWhenRegisteredAfterCancel() {
        AtomicBoolean hookRan = new AtomicBoolean();
        watchdog.begin(CALL_ID, "run_command", null, 30);
        watchdog.cancel(CALL_ID);

        watchdog.onCancel(CALL_ID, () -> hookRan.set(true));

        assertTrue(hookRan.get());
    }

    @Test
    void shouldCancelActiveInvocationOnlyWhileRunning() {
        assertFalse(watchdog.cancelActive());

        watchdog.begin(CALL_ID, "write_file", "a.txt", 30);
        assertTrue(watchdog.cancelActive());

        watchdog.finish(CALL_ID);
        assertFalse(watchdog.cancelActive());
        assertTrue(watchdog.activeInvocation().isEmpty());
    }

    // ==================== pause and countdown ====================

    @Test
    void shouldNotCountPausedTime() {
        watchdog.begin(CALL_ID, "run_command", null, 3);
        clock.advance(Duration.ofSeconds(1));

        assertTrue(watchdog.togglePause());
        assertTrue(watchdog.remainingSeconds(CALL_ID).isEmpty());
        clock.advance(Duration.ofSeconds(60));
        assertDoesNotThrow(() -> watchdog.check(CALL_ID));

        assertFalse(watchdog.togglePause());
        assertEquals(OptionalLong.of(2), watchdog.remainingSeconds(CALL_ID));
    }

    @Test
    void shouldKeepPauseWhenParallelToolsStartAndFinish() {
        watchdog.begin(CALL_ID, "run_command", null, 3);
        assertTrue(watchdog.togglePause());

        watchdog.begin("call_2", "read_file", "a.txt", 3);
        assertTrue(watchdog.isPaused());
        watchdog.finish("call_2");
        assertTrue(watchdog.isPaused());

        clock.advance(Duration.ofSeconds(60));
        assertDoesNotThrow(() -> watchdog.check(CALL_ID));
        assertTrue(watchdog.remainingSeconds(CALL_ID).isEmpty());
    }

    @Test
    void shouldGiveInvocationStartedWhilePausedItsFullWindow() {
        assertTrue(watchdog.togglePause());
        clock.advance(Duration.ofSeconds(10));
        watchdog.begin(CALL_ID, "run_command", null, 5);
        clock.advance(Duration.ofSeconds(20));

        assertFalse(watchdog.togglePause());

        assertEquals(OptionalLong.of(5), watchdog.remainingSeconds(CALL_ID));
    }

    @Test
    void shouldExposeCountdownOnlyNearDeadline() {
        watchdog.begin(CALL_ID, "run_command", null, 20);
        assertTrue(watchdog.countdownSeconds().isEmpty());

        clock.advance(Duration.ofSeconds(16));
        assertEquals(OptionalLong.of(4), watchdog.countdownSeconds());

        clock.advance(Duration.ofSeconds(10));
        assertTrue(watchdog.countdownSeconds().isEmpty());
    }
}
