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

import java.util.ArrayList;
import java.util.List;

/**
 * Result of {@link GraphValidator#validate}. Empty reports are never rendered.
 */
public record ValidationReport(List<ValidationIssue> issues, int totalPaths, int totalActivities) {

    public static final ValidationReport EMPTY = new ValidationReport(List.of(), 0, 0);

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public List<ValidationIssue> issuesOf(ValidationIssue.Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).toList();
    }

    public List<ValidationIssue> issuesOf(ValidationIssue.Category category) {
        return issues.stream().filter(i -> i.category() == category).toList();
    }

    public String format() {
        List<String> lines = new ArrayList<>(issues.size() + 5);
        lines.add("--- Validation Report ---");
        lines.add("Total Paths: " + totalPaths);
        lines.add("Total Activities: " + totalActivities);
        lines.add("Warnings: " + issuesOf(ValidationIssue.Severity.WARNING).size());
        lines.add("");
        for (ValidationIssue issue : issues) {
            lines.add(issue.format());
        }
        return String.join("\n", lines);
    }
}
