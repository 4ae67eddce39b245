package me.golemcore.conductor.port.outbound;

import java.nio.file.Path;

/**
 * Resolves declared file targets against a project root.
 */
public interface PathValidatorPort {

    /**
     * Resolves {@code declaredPath} (absolute or project-relative) against the
     * root.
     *
     * @throws me.golemcore.conductor.domain.service.PathEscapeException
     *             when the resolved path lies outside the project root
     */
    Path resolve(String projectRoot, String declaredPath);
}
