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

import org.fireflyframework.workflowgraph.core.model.PathStep;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One complete route through a workflow: the steps taken, in execution order, and the
 * outcome chosen at every branch point keyed by branch point id.
 */
public record ExecutionPath(String pathId, List<PathStep> steps, Map<String, Boolean> outcomes) {

    public static final String ID_PREFIX = "path_";

    public ExecutionPath {
        Objects.requireNonNull(pathId, "pathId");
        steps = List.copyOf(steps);
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public static String idFor(int index) {
        return ID_PREFIX + index;
    }

    /** Steps that are not branch outcomes: activities, child workflows and external signals. */
    public List<PathStep> plainSteps() {
        return steps.stream().filter(step -> !step.kind().isBranch()).toList();
    }

    public boolean outcomeOf(String branchId) {
        Boolean outcome = outcomes.get(branchId);
        if (outcome == null) {
            throw new IllegalArgumentException("Path " + pathId + " has no outcome for branch point " + branchId);
        }
        return outcome;
    }
}
