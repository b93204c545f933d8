/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.workflowgraph.core.exception;

import java.util.Map;

/**
 * Raised when the syntax tree cannot be used for extraction: no entry type, no entry
 * method, or unparseable source.
 */
public final class StructuralException extends WorkflowGraphException {

    private final int line;
    private final String suggestion;

    public StructuralException(String message, int line, String suggestion) {
        this(message, line, suggestion, null);
    }

    public StructuralException(String message, int line, String suggestion, Throwable cause) {
        super("Line " + line + ": " + message + ". Suggestion: " + suggestion,
                "WORKFLOW_GRAPH_STRUCTURAL_ERROR",
                Map.of("line", line, "suggestion", suggestion),
                cause);
        this.line = line;
        this.suggestion = suggestion;
    }

    public int getLine() {
        return line;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
