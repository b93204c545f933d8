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

package org.fireflyframework.workflowgraph.core.model;

import org.fireflyframework.workflowgraph.core.exception.DuplicateBranchPointException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything the extractor learned about one workflow. Immutable; consumed read-only by
 * the path generator, the validator and the renderer.
 */
public record WorkflowMetadata(
        String entryTypeName,
        String entryMethodName,
        int entryTypeLine,
        int entryMethodLine,
        List<ActivityCall> activities,
        List<DecisionPoint> decisionPoints,
        List<SignalPoint> signalPoints,
        List<ChildWorkflowCall> childWorkflowCalls,
        List<ExternalSignalCall> externalSignalCalls,
        List<SignalHandlerDefinition> signalHandlers,
        List<MarkerDiagnostic> diagnostics
) {

    public WorkflowMetadata {
        Objects.requireNonNull(entryTypeName, "entryTypeName");
        Objects.requireNonNull(entryMethodName, "entryMethodName");
        activities = activities != null ? List.copyOf(activities) : List.of();
        decisionPoints = decisionPoints != null ? List.copyOf(decisionPoints) : List.of();
        signalPoints = signalPoints != null ? List.copyOf(signalPoints) : List.of();
        childWorkflowCalls = childWorkflowCalls != null ? List.copyOf(childWorkflowCalls) : List.of();
        externalSignalCalls = externalSignalCalls != null ? List.copyOf(externalSignalCalls) : List.of();
        signalHandlers = signalHandlers != null ? List.copyOf(signalHandlers) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        requireUniqueIds(entryTypeName, decisionPoints, signalPoints);
    }

    /**
     * Convenience constructor for metadata built by hand (tests, other front ends):
     * no source positions for the entry type, no handlers and no diagnostics.
     */
    public WorkflowMetadata(String entryTypeName,
                            String entryMethodName,
                            List<ActivityCall> activities,
                            List<DecisionPoint> decisionPoints,
                            List<SignalPoint> signalPoints,
                            List<ChildWorkflowCall> childWorkflowCalls,
                            List<ExternalSignalCall> externalSignalCalls) {
        this(entryTypeName, entryMethodName, 0, 0, activities, decisionPoints, signalPoints,
                childWorkflowCalls, externalSignalCalls, List.of(), List.of());
    }

    public int branchCount() {
        return decisionPoints.size() + signalPoints.size();
    }

    public boolean hasBranches() {
        return branchCount() > 0;
    }

    /** 2^branchCount, saturating at {@link Long#MAX_VALUE}. */
    public long totalPaths() {
        return totalPathsFor(branchCount());
    }

    /** Activities, child workflow calls and external signal calls in declaration-family order. */
    public List<WorkflowCall> calls() {
        List<WorkflowCall> calls = new ArrayList<>(
                activities.size() + childWorkflowCalls.size() + externalSignalCalls.size());
        calls.addAll(activities);
        calls.addAll(childWorkflowCalls);
        calls.addAll(externalSignalCalls);
        return calls;
    }

    /** Decisions followed by signals. */
    public List<BranchPoint> branchPoints() {
        List<BranchPoint> points = new ArrayList<>(branchCount());
        points.addAll(decisionPoints);
        points.addAll(signalPoints);
        return points;
    }

    public boolean isEmpty() {
        return activities.isEmpty() && childWorkflowCalls.isEmpty() && externalSignalCalls.isEmpty();
    }

    private static void requireUniqueIds(String workflow, List<DecisionPoint> decisions, List<SignalPoint> signals) {
        Set<String> ids = new HashSet<>();
        for (DecisionPoint decision : decisions) {
            if (!ids.add(decision.id())) {
                throw new DuplicateBranchPointException(workflow, decision.id());
            }
        }
        for (SignalPoint signal : signals) {
            if (!ids.add(signal.id())) {
                throw new DuplicateBranchPointException(workflow, signal.id());
            }
        }
    }

    public static long totalPathsFor(int branchCount) {
        return branchCount >= Long.SIZE - 1 ? Long.MAX_VALUE : 1L << branchCount;
    }
}
