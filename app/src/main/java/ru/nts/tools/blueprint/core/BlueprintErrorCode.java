/*
 * Copyright 2025 Aristo
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
 */
package ru.nts.tools.blueprint.core;

import java.util.Map;

/**
 * Structured error codes for the blueprint engine.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example output:
 * <pre>
 * [ERROR: SEED_NOT_FOUND]
 * Message: Seed file not found
 * Solution: Seed 'src/main.py' (line 4) does not exist under the project root. Fix the path after '<<'.
 * Context: seed=src/main.py, line=4
 * </pre>
 */
public enum BlueprintErrorCode {

    // ============ Blueprint Errors ============

    BLUEPRINT_NOT_FOUND("Blueprint file not found",
            "Check the blueprint path '%path%'."),

    BLUEPRINT_NOT_READABLE("Blueprint file not readable",
            "Check file permissions and encoding of '%path%'. Blueprints must be UTF-8."),

    COMPILE_FAILED("Blueprint contains fatal faults",
            "Fix the fatal diagnostics first (first at line %line%: %detail%)."),

    RECURSION_LIMIT("Blueprint nesting is too deep",
            "Nesting exceeded %limit% levels near line %line%. Flatten the blueprint or split it."),

    // ============ Planning Errors ============

    SEED_NOT_FOUND("Seed file not found",
            "Seed '%seed%' (line %line%) does not exist under the project root. Fix the path after '<<'."),

    PATH_OUTSIDE_ROOT("Path escapes the project root",
            "Path '%path%' resolves outside of %root%. Use relative paths without '..'."),

    PATH_PROTECTED("Path is reserved by the engine",
            "Path '%path%' belongs to engine infrastructure (chronicle, .scaffold, .git) and cannot be planned."),

    // ============ Materialization Errors ============

    CONFLICTS_PRESENT("Reconciliation produced conflicts",
            "%count% path(s) diverged from history: %paths%. Resolve manually, or rerun with conflict policy FORCE or SKIP."),

    PROJECT_LOCKED("Another run holds the project lock",
            "Wait for the other run to finish. Lock file: %lock%."),

    DISK_CHANGED("File changed on disk after planning",
            "Expected hash %expected% but found %actual% at '%path%'. Re-run the plan."),

    // ============ Chronicle Errors ============

    CHRONICLE_UNWRITABLE("Chronicle could not be written",
            "Check permissions of '%path%'. Disk state is applied but history was not committed."),

    // ============ System Errors ============

    IO_ERROR("I/O error occurred",
            "Check disk space and permissions. Try again."),

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Check logs for details.");

    private final String message;
    private final String solution;

    BlueprintErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (path, line, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    public String format() {
        return format(null);
    }
}
