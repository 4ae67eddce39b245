package me.golemcore.conductor.domain.system.toolloop;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Text heuristics over model responses: splitting the
 * {@code <ide_reasoning>} block from visible content and detecting responses
 * that need a corrective re-ask.
 */
public final class ReasoningParser {

    static final String START_TAG = "<ide_reasoning>";
    static final String END_TAG = "</ide_reasoning>";

    private static final List<String> SECTION_KEYS = List.of("analyze:", "research:", "plan:", "reflect:");
    private static final List<String> PLACEHOLDERS = List.of("Analyze:...", "Research:...", "Plan:...",
            "Reflect:...");
    private static final Set<String> BAD_TOKENS = Set.of("...", "…", "n/a", "na", "none", "nil");
    private static final int MIN_CONCRETE_CHARS = 6;
    private static final int MIN_CONCRETE_SECTIONS = 2;

    private static final List<String> FOLLOWUP_TRIGGERS = List.of(
            "i will implement", "i'll implement",
            "i will update", "i'll update",
            "i will patch", "i'll patch",
            "i will fix", "i'll fix",
            "i am going to implement", "i'm going to implement",
            "next i will", "now i will");

    private static final List<String> USER_INPUT_REQUESTS = List.of(
            "please provide", "could you provide", "can you provide",
            "please share", "could you share", "can you share",
            "please confirm", "could you confirm",
            "let me know which", "let me know if you want",
            "would you like me to", "do you want me to",
            "please paste", "please send");

    private ReasoningParser() {
    }

    /** Reasoning and visible content of a response. Reasoning is null when absent or empty. */
    public record Split(String reasoning, String content) {
    }

    public static Split split(String text) {
        if (text == null || text.isEmpty()) {
            return new Split(null, "");
        }
        int start = text.indexOf(START_TAG);
        int end = text.indexOf(END_TAG);
        if (start < 0 || end < 0 || start >= end) {
            return new Split(null, text);
        }
        String reasoning = text.substring(start + START_TAG.length(), end).trim();
        String content = (text.substring(0, start) + text.substring(end + END_TAG.length())).trim();
        return new Split(reasoning.isEmpty() ? null : reasoning, content);
    }

    /**
     * A reasoning block is present but misses one of the required sections.
     */
    public static boolean needsReasoningFormatCorrection(String text) {
        String reasoning = split(text).reasoning();
        if (reasoning == null) {
            return false;
        }
        String lower = reasoning.toLowerCase(Locale.ROOT);
        return SECTION_KEYS.stream().anyMatch(key -> !lower.contains(key));
    }

    /**
     * A reasoning block is present but holds copied placeholders, or fewer than
     * two sections with concrete content.
     */
    public static boolean isLowQualityReasoning(String text) {
        String reasoning = split(text).reasoning();
        if (reasoning == null) {
            return false;
        }
        for (String placeholder : PLACEHOLDERS) {
            if (reasoning.contains(placeholder)) {
                return true;
            }
        }
        List<String> sections = sectionValues(reasoning);
        if (sections.isEmpty()) {
            return true;
        }
        int concrete = 0;
        for (String value : sections) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            if (normalized.isEmpty() || BAD_TOKENS.contains(normalized)
                    || "...".equals(normalized.replace(" ", "").replace("\n", ""))) {
                continue;
            }
            if (normalized.length() >= MIN_CONCRETE_CHARS) {
                concrete++;
            }
        }
        return concrete < MIN_CONCRETE_SECTIONS;
    }

    /**
     * The model announced work ("I will implement ...") without calling tools.
     */
    public static boolean shouldForceToolFollowup(String content) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        return FOLLOWUP_TRIGGERS.stream().anyMatch(lower::contains);
    }

    /**
     * The model asks the user for more input instead of proceeding.
     */
    public static boolean isRequestingUserInput(String content) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        String lower = split(content).content().toLowerCase(Locale.ROOT);
        return USER_INPUT_REQUESTS.stream().anyMatch(lower::contains);
    }

    private static List<String> sectionValues(String reasoning) {
        List<String> values = new ArrayList<>();
        for (String line : reasoning.split("\\R")) {
            String trimmed = line.strip();
            String lower = trimmed.toLowerCase(Locale.ROOT);
            for (String key : SECTION_KEYS) {
                if (lower.startsWith(key)) {
                    values.add(trimmed.substring(key.length()));
                    break;
                }
            }
        }
        return values;
    }
}
