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

package org.fireflyframework.workflowgraph.core.options;

import org.fireflyframework.workflowgraph.core.exception.InvalidConfigurationException;

import java.util.List;

/**
 * Names the extractor matches against annotations and call expressions. Annotation names
 * are compared with the simple (last) segment of the annotation name, call names with the
 * called method's identifier, so {@code @Workflow}, {@code @marker.Workflow} and
 * {@code Workflow.executeActivity(...)} / {@code executeActivity(...)} all match.
 *
 * @param workflowType      type-level annotation marking the workflow class
 * @param entryMethod       method-level annotation marking the entry method
 * @param signalHandler     method-level annotation marking signal handlers
 * @param activityCalls     methods whose invocation executes an activity
 * @param childWorkflowCalls methods whose invocation starts a child workflow
 * @param externalSignalCalls methods whose invocation signals another workflow
 * @param decisionCalls     decision markers, {@code (boolean, String name)}
 * @param signalCalls       wait-for-signal markers, {@code (condition, timeout, String name)}
 */
public record MarkerNames(
        String workflowType,
        String entryMethod,
        String signalHandler,
        List<String> activityCalls,
        List<String> childWorkflowCalls,
        List<String> externalSignalCalls,
        List<String> decisionCalls,
        List<String> signalCalls
) {

    public static final MarkerNames DEFAULT = new MarkerNames(
            "Workflow",
            "WorkflowMethod",
            "SignalMethod",
            List.of("executeActivity", "executeLocalActivity"),
            List.of("executeChildWorkflow"),
            List.of("signalExternalWorkflow"),
            List.of("toDecision"),
            List.of("waitCondition"));

    public MarkerNames {
        requireName("markers.workflow-type", workflowType);
        requireName("markers.entry-method", entryMethod);
        requireName("markers.signal-handler", signalHandler);
        activityCalls = requireNames("markers.activity-calls", activityCalls);
        childWorkflowCalls = requireNames("markers.child-workflow-calls", childWorkflowCalls);
        externalSignalCalls = requireNames("markers.external-signal-calls", externalSignalCalls);
        decisionCalls = requireNames("markers.decision-calls", decisionCalls);
        signalCalls = requireNames("markers.signal-calls", signalCalls);
    }

    public static String simpleName(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : name;
    }

    public boolean isWorkflowType(String annotationName) {
        return workflowType.equals(simpleName(annotationName));
    }

    public boolean isEntryMethod(String annotationName) {
        return entryMethod.equals(simpleName(annotationName));
    }

    public boolean isSignalHandler(String annotationName) {
        return signalHandler.equals(simpleName(annotationName));
    }

    private static void requireName(String option, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException(option, "must not be blank");
        }
    }

    private static List<String> requireNames(String option, List<String> values) {
        if (values == null) {
            return List.of();
        }
        for (String value : values) {
            requireName(option, value);
        }
        return List.copyOf(values);
    }
}
