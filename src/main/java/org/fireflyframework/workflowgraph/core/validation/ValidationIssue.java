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

package org.fireflyframework.workflowgraph.core.validation;

/**
 * One finding about an analyzed workflow. {@code location} reads
 * {@code <WorkflowType>.<method>:<line>}; {@code suggestion} may be {@code null}.
 */
public record ValidationIssue(Severity severity, Category category, String message,
                              String location, String suggestion) {

    public enum Severity { INFO, WARNING, ERROR }

    public enum Category {
        UNREACHABLE, EMPTY, BRANCH_LIMIT, MARKER, SIGNAL_HANDLER;

        String tag() {
            return name().replace('_', '-');
        }
    }

    public ValidationIssue(Severity severity, Category category, String message, String location) {
        this(severity, category, message, location, null);
    }

    public String format() {
        String line = "[" + severity + "] [" + category.tag() + "] " + message + " at " + location;
        return suggestion == null ? line : line + "\n   Suggestion: " + suggestion;
    }
}
