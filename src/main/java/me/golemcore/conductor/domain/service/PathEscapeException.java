package me.golemcore.conductor.domain.service;

/**
 * A declared path resolved outside the project root.
 */
public class PathEscapeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public PathEscapeException(String declaredPath, String projectRoot) {
        super("Path escapes project root: " + declaredPath + " (root: " + projectRoot + ")");
    }
}
