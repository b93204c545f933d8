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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.workflowgraph.core.model.ActivityCall;
import org.fireflyframework.workflowgraph.core.model.MarkerDiagnostic;
import org.fireflyframework.workflowgraph.core.model.PathStep;
import org.fireflyframework.workflowgraph.core.model.SignalHandlerDefinition;
import org.fireflyframework.workflowgraph.core.model.SignalPoint;
import org.fireflyframework.workflowgraph.core.model.StepKind;
import org.fireflyframework.workflowgraph.core.model.WorkflowMetadata;
import org.fireflyframework.workflowgraph.core.options.GraphOptions;
import org.fireflyframework.workflowgraph.core.path.ExecutionPath;
import org.fireflyframework.workflowgraph.core.validation.ValidationIssue.Category;
import org.fireflyframework.workflowgraph.core.validation.ValidationIssue.Severity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Quality checks over an analyzed workflow: activities no path reaches, workflows without
 * steps, too many branch points, marker diagnostics and signal handlers nothing waits for.
 * Findings never abort the pipeline.
 */
@Slf4j
public class GraphValidator {

    public ValidationReport validate(WorkflowMetadata metadata, List<ExecutionPath> paths, GraphOptions options) {
        if (options.suppressValidation()) {
            return ValidationReport.EMPTY;
        }
        List<ValidationIssue> issues = new ArrayList<>();
        String workflow = metadata.entryTypeName() + "." + metadata.entryMethodName();

        // Unreachable activities
        Set<String> reached = new HashSet<>();
        for (ExecutionPath path : paths) {
            for (PathStep step : path.steps()) {
                if (step.kind() == StepKind.ACTIVITY) {
                    reached.add(key(step.name(), step.sourceLine()));
                }
            }
        }
        for (ActivityCall activity : metadata.activities()) {
            if (!reached.contains(key(activity.name(), activity.sourceLine()))) {
                issues.add(new ValidationIssue(Severity.WARNING, Category.UNREACHABLE,
                        "Activity '" + activity.name() + "' is on no execution path",
                        workflow + ":" + activity.sourceLine(),
                        "check the conditions guarding the call or remove it"));
            }
        }

        if (metadata.isEmpty()) {
            issues.add(new ValidationIssue(Severity.WARNING, Category.EMPTY,
                    "Workflow calls no activities, child workflows or external signals",
                    workflow + ":" + metadata.entryMethodLine()));
        }

        if (metadata.branchCount() > options.maxBranchPoints()) {
            issues.add(new ValidationIssue(Severity.WARNING, Category.BRANCH_LIMIT,
                    "Workflow has " + metadata.branchCount() + " branch points (limit " + options.maxBranchPoints()
                            + ", " + metadata.totalPaths() + " paths)",
                    workflow + ":" + metadata.entryMethodLine(),
                    "split the workflow into child workflows"));
        }

        for (MarkerDiagnostic diagnostic : metadata.diagnostics()) {
            issues.add(new ValidationIssue(Severity.WARNING, Category.MARKER,
                    diagnostic.marker() + ": " + diagnostic.message(),
                    workflow + ":" + diagnostic.sourceLine()));
        }

        Set<String> awaited = new HashSet<>();
        for (SignalPoint signal : metadata.signalPoints()) {
            awaited.add(signal.displayName());
        }
        for (SignalHandlerDefinition handler : metadata.signalHandlers()) {
            if (!awaited.contains(handler.signalName())) {
                issues.add(new ValidationIssue(Severity.INFO, Category.SIGNAL_HANDLER,
                        "Signal handler '" + handler.methodName() + "' receives '" + handler.signalName()
                                + "' but no wait condition names it",
                        metadata.entryTypeName() + "." + handler.methodName() + ":" + handler.sourceLine()));
            }
        }

        for (ValidationIssue issue : issues) {
            switch (issue.severity()) {
                case WARNING -> log.warn("[validation] {} at {}", issue.message(), issue.location());
                case INFO -> log.info("[validation] {} at {}", issue.message(), issue.location());
                case ERROR -> log.error("[validation] {} at {}", issue.message(), issue.location());
            }
        }
        return new ValidationReport(issues, paths.size(), metadata.activities().size());
    }

    private static String key(String name, int line) {
        return name + "@" + line;
    }
}
