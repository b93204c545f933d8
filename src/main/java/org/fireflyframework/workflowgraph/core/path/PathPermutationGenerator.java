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

package org.fireflyframework.workflowgraph.core.path;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.workflowgraph.core.exception.PathExplosionException;
import org.fireflyframework.workflowgraph.core.model.BranchKind;
import org.fireflyframework.workflowgraph.core.model.BranchPoint;
import org.fireflyframework.workflowgraph.core.model.PathStep;
import org.fireflyframework.workflowgraph.core.model.WorkflowCall;
import org.fireflyframework.workflowgraph.core.model.WorkflowMetadata;
import org.fireflyframework.workflowgraph.core.options.GraphOptions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expands {@link WorkflowMetadata} into every execution path.
 *
 * <p>Plain steps and branch points are merged into one execution order sorted by source
 * line; the sort is stable, so ties keep declaration order (activities, child workflow
 * calls, external signals, decisions, signals). With {@code b} branch points the generator
 * yields exactly {@code 2^b} paths, one per outcome tuple, in lexicographic tuple order
 * with {@code true} before {@code false}. A plain step that no branch point scopes is on
 * every path; a scoped step is on a path only if its line is in the chosen outcome's set
 * of every branch point scoping it.
 *
 * <p>The explosion ceiling is checked before a single path is built.
 */
@Slf4j
public class PathPermutationGenerator {

    public List<ExecutionPath> generate(WorkflowMetadata metadata) {
        return generate(metadata, GraphOptions.defaults());
    }

    public List<ExecutionPath> generate(WorkflowMetadata metadata, GraphOptions options) {
        List<Object> executionOrder = executionOrder(metadata);
        List<BranchPoint> branchPoints = metadata.branchPoints();
        int branchCount = branchPoints.size();

        if (branchCount == 0) {
            List<PathStep> steps = new ArrayList<>();
            for (Object element : executionOrder) {
                steps.add(((WorkflowCall) element).toStep());
            }
            log.debug("[workflow-graph] paths.generated workflow={} branchPoints=0 paths=1", metadata.entryTypeName());
            return List.of(new ExecutionPath(ExecutionPath.idFor(0), steps, Map.of()));
        }

        long totalPaths = WorkflowMetadata.totalPathsFor(branchCount);
        if (totalPaths > options.explosionCeiling()) {
            log.warn("[workflow-graph] paths.refused workflow={} decisions={} signals={} totalPaths={} ceiling={}",
                    metadata.entryTypeName(), metadata.decisionPoints().size(), metadata.signalPoints().size(),
                    totalPaths, options.explosionCeiling());
            throw new PathExplosionException(metadata.decisionPoints().size(), metadata.signalPoints().size(),
                    totalPaths, options.explosionCeiling());
        }

        // Tuple positions follow the merged execution order, not decisions-then-signals.
        List<BranchPoint> orderedBranches = executionOrder.stream()
                .filter(BranchPoint.class::isInstance)
                .map(BranchPoint.class::cast)
                .toList();

        int pathCount = (int) totalPaths;
        List<ExecutionPath> paths = new ArrayList<>(pathCount);
        for (int index = 0; index < pathCount; index++) {
            Map<String, Boolean> outcomes = new LinkedHashMap<>();
            for (int position = 0; position < branchCount; position++) {
                boolean outcome = ((index >> (branchCount - 1 - position)) & 1) == 0;
                outcomes.put(orderedBranches.get(position).id(), outcome);
            }
            paths.add(new ExecutionPath(ExecutionPath.idFor(index), buildSteps(executionOrder, orderedBranches, outcomes), outcomes));
        }
        log.debug("[workflow-graph] paths.generated workflow={} branchPoints={} paths={}",
                metadata.entryTypeName(), branchCount, paths.size());
        return paths;
    }

    private List<PathStep> buildSteps(List<Object> executionOrder, List<BranchPoint> branches,
                                      Map<String, Boolean> outcomes) {
        List<PathStep> steps = new ArrayList<>();
        for (Object element : executionOrder) {
            if (element instanceof BranchPoint branch) {
                boolean outcome = outcomes.get(branch.id());
                steps.add(branch.kind() == BranchKind.SIGNAL
                        ? new PathStep.SignalOutcomeStep(branch.id(), branch.displayName(), branch.sourceLine(), outcome)
                        : new PathStep.DecisionOutcomeStep(branch.id(), branch.displayName(), branch.sourceLine(), outcome));
            } else {
                WorkflowCall call = (WorkflowCall) element;
                if (isIncluded(call.sourceLine(), branches, outcomes)) {
                    steps.add(call.toStep());
                }
            }
        }
        return steps;
    }

    /**
     * Permissive by absence, restrictive by presence: a line no branch point scopes is
     * always included; otherwise every scoping branch point must have chosen the outcome
     * whose set holds the line.
     */
    static boolean isIncluded(int line, List<BranchPoint> branches, Map<String, Boolean> outcomes) {
        for (BranchPoint branch : branches) {
            if (branch.scopes(line) && !branch.linesFor(outcomes.get(branch.id())).contains(line)) {
                return false;
            }
        }
        return true;
    }

    private static List<Object> executionOrder(WorkflowMetadata metadata) {
        List<Object> order = new ArrayList<>(metadata.calls());
        order.addAll(metadata.branchPoints());
        // List.sort is stable.
        order.sort(Comparator.comparingInt(PathPermutationGenerator::lineOf));
        return order;
    }

    private static int lineOf(Object element) {
        return element instanceof BranchPoint branch
                ? branch.sourceLine()
                : ((WorkflowCall) element).sourceLine();
    }
}
