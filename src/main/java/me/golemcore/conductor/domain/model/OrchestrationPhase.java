package me.golemcore.conductor.domain.model;

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

/**
 * Stages of the orchestrated agent run, declared in execution order. Each phase
 * carries the system instruction that introduces the role and the policy that
 * selects which tools the model may call while the phase is active.
 *
 * <p>
 * Iteration caps for the looping phases live in configuration; see
 * {@code conductor.orchestration.*}.
 */
public enum OrchestrationPhase {

    ARCHITECT(ToolPolicy.NONE, null,
            "You are the Architect role. Provide architecture notes and a short implementation plan. "
                    + "Do not call tools."),

    PLANNER(ToolPolicy.SINGLE_TOOL, "planner",
            "You are the Planner role. Create or update a concrete execution plan using the planner tool. "
                    + "Output must be deterministic."),

    WORKER(ToolPolicy.ALL, null,
            "You are the Worker role. Implement the plan. Prefer proposing changes via patch sets; "
                    + "avoid direct writes unless necessary. Use tools."),

    REVIEWER(ToolPolicy.ALL, null,
            "You are the QA role. Review the proposed patch set(s) and tool outputs. If fixes are needed, "
                    + "propose edits. Otherwise, proceed to apply the patch set."),

    VERIFIER(ToolPolicy.COMMAND_ALLOWLIST, "run_command",
            "You are the Verifier role. Run a small set of allowlisted commands to verify changes. "
                    + "Do not run long-lived commands."),

    FINALIZER(ToolPolicy.NONE, null,
            "You are the Finalizer role. Provide a concise summary: what changed, touched files, verify status, "
                    + "and how to undo (checkpoint/git). Do not call tools.");

    private final ToolPolicy toolPolicy;
    private final String toolName;
    private final String instruction;

    OrchestrationPhase(ToolPolicy toolPolicy, String toolName, String instruction) {
        this.toolPolicy = toolPolicy;
        this.toolName = toolName;
        this.instruction = instruction;
    }

    public ToolPolicy getToolPolicy() {
        return toolPolicy;
    }

    /**
     * The single allowed tool for {@link ToolPolicy#SINGLE_TOOL}, or the wrapped
     * command tool for {@link ToolPolicy#COMMAND_ALLOWLIST}.
     */
    public String getToolName() {
        return toolName;
    }

    public String getInstruction() {
        return instruction;
    }

    /**
     * Whether the phase runs the bounded tool loop (as opposed to a single
     * exchange).
     */
    public boolean isLooping() {
        return this == WORKER || this == REVIEWER || this == VERIFIER;
    }

    /** Tool selection rule applied while a phase is active. */
    public enum ToolPolicy {
        NONE, SINGLE_TOOL, ALL, COMMAND_ALLOWLIST
    }
}
