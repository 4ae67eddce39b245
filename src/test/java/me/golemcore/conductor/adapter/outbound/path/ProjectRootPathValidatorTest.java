package me.golemcore.conductor.adapter.outbound.path;

import me.golemcore.conductor.domain.service.PathEscapeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProjectRootPathValidatorTest {

    @TempDir
    Path tempDir;

    private final ProjectRootPathValidator validator = new ProjectRootPathValidator();

    @Test
    void shouldNormalizeRelativePathInsideRoot() {
        Path resolved = validator.resolve(tempDir.toString(), "./src/../README.md");

        assertEquals(tempDir.toAbsolutePath().normalize().resolve("README.md"), resolved);
    }

    @Test
    void shouldAcceptAbsolutePathInsideRoot() {
        String inside = tempDir.resolve("src/App.java").toString();

        assertEquals(tempDir.toAbsolutePath().normalize().resolve("src/App.java"),
                validator.resolve(tempDir.toString(), inside));
    }

    @Test
    void shouldRejectEscapes() {
        assertThrows(PathEscapeException.class, () -> validator.resolve(tempDir.toString(), "../outside.txt"));
        assertThrows(PathEscapeException.class,
                () -> validator.resolve(tempDir.toString(), tempDir.getParent().resolve("x").toString()));
    }

    @Test
    void shouldRejectBlankPath() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> validator.resolve(tempDir.toString(), "  "));

        assertEquals("Path must not be blank", exception.getMessage());
    }
}
