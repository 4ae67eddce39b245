package me.golemcore.conductor.adapter.outbound.path;

import me.golemcore.conductor.domain.service.PathEscapeException;
import me.golemcore.conductor.port.outbound.PathValidatorPort;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves declared paths against the project root with NIO normalization.
 * Absolute paths are accepted only when they lie under the root.
 */
@Component
public class ProjectRootPathValidator implements PathValidatorPort {

    @Override
    public Path resolve(String projectRoot, String declaredPath) {
        if (declaredPath == null || declaredPath.isBlank()) {
            throw new IllegalArgumentException("Path must not be blank");
        }
        Path root = Paths.get(projectRoot).toAbsolutePath().normalize();
        Path declared = Paths.get(declaredPath.trim());
        Path resolved = (declared.isAbsolute() ? declared : root.resolve(declared)).normalize();
        if (!resolved.startsWith(root)) {
            throw new PathEscapeException(declaredPath, projectRoot);
        }
        return resolved;
    }
}
