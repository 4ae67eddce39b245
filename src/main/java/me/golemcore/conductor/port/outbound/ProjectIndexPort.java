package me.golemcore.conductor.port.outbound;

import java.util.List;

/**
 * Lookup into a project index (symbols, files, snippets).
 */
public interface ProjectIndexPort {

    /**
     * Returns the snippets most relevant to the query, best first.
     */
    List<String> search(String projectRoot, String query, int limit);
}
