package me.golemcore.conductor.domain.component;

import me.golemcore.conductor.domain.model.ToolArguments;
import me.golemcore.conductor.domain.support.CancellationToken;

import java.util.function.Consumer;

/**
 * Tool that reports incremental output while it runs (e.g. a command streaming
 * stdout). Every chunk counts as liveness for the timeout watchdog.
 */
public interface ProgressReportingToolComponent extends ToolComponent {

    String execute(ToolArguments arguments, CancellationToken cancellation, Consumer<String> onChunk)
            throws Exception;

    @Override
    default String execute(ToolArguments arguments, CancellationToken cancellation) throws Exception {
        return execute(arguments, cancellation, chunk -> {
        });
    }
}
