package me.golemcore.conductor.adapter.outbound.context;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.port.outbound.ContextBuilderPort;
import me.golemcore.conductor.port.outbound.ProjectIndexPort;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the augmented context sent with every model request: the caller's
 * explicit context followed by project index matches for a few keywords of
 * the user input. Without an index only the explicit context is used.
 */
@Slf4j
public class ExplicitContextBuilder implements ContextBuilderPort {

    static final String INDEX_HEADER = "CODEBASE INDEX (matching symbols):";
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final int MAX_TOKENS = 5;
    private static final int RESULTS_PER_TOKEN = 10;
    private static final int MAX_RESULTS = 25;

    private final ProjectIndexPort projectIndex;

    public ExplicitContextBuilder(ProjectIndexPort projectIndex) {
        this.projectIndex = projectIndex;
    }

    @Override
    public String buildContext(String userInput, String explicitContext, String projectRoot) {
        List<String> parts = new ArrayList<>();
        if (explicitContext != null && !explicitContext.isEmpty()) {
            parts.add(explicitContext);
        }

        if (projectIndex != null && projectRoot != null) {
            List<String> matches = new ArrayList<>();
            for (String token : keywords(userInput)) {
                try {
                    matches.addAll(projectIndex.search(projectRoot, token, RESULTS_PER_TOKEN));
                } catch (RuntimeException e) {
                    log.debug("[LLM] Index lookup failed for '{}': {}", token, e.getMessage());
                }
            }
            if (!matches.isEmpty()) {
                StringBuilder section = new StringBuilder(INDEX_HEADER);
                matches.stream().limit(MAX_RESULTS).forEach(match -> section.append("\n- ").append(match));
                parts.add(section.toString());
            }
        }
        return parts.isEmpty() ? null : String.join("\n\n", parts);
    }

    static Set<String> keywords(String userInput) {
        Set<String> tokens = new LinkedHashSet<>();
        if (userInput == null) {
            return tokens;
        }
        for (String token : userInput.split("[^\\p{L}\\p{N}_]+")) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
                if (tokens.size() == MAX_TOKENS) {
                    break;
                }
            }
        }
        return tokens;
    }
}
