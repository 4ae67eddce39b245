package me.golemcore.conductor.domain.component;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.conductor.domain.model.ToolArguments;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.support.CancellationToken;

/**
 * Component exposing a named capability the model can invoke through a tool
 * call. Concrete tools (file access, command execution, code search) live
 * outside the engine; the engine only invokes them through this contract.
 *
 * <p>
 * Implementations must be safe to cancel: a long-running body should check
 * {@link CancellationToken#isCancelled()} (or honor thread interruption)
 * between units of work. Failures surface as thrown exceptions, never as
 * special return values.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool and returns its textual output.
     *
     * @param arguments
     *            merged arguments (model arguments plus correlation fields)
     * @param cancellation
     *            cooperative cancellation signal for this invocation
     * @return the tool output
     * @throws Exception
     *             when the tool fails
     */
    String execute(ToolArguments arguments, CancellationToken cancellation) throws Exception;

    /**
     * Returns the unique name of this tool.
     *
     * @return the tool name
     */
    default String getToolName() {
        return getDefinition().getName();
    }
}
