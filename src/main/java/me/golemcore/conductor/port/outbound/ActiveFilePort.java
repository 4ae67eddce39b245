package me.golemcore.conductor.port.outbound;

import java.util.Optional;

/**
 * Exposes the file the user is currently focused on, used as the default
 * target of file tools called without a path.
 */
public interface ActiveFilePort {

    Optional<String> activeFilePath();
}
