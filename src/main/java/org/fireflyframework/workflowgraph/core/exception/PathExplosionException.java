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
 * Raised before any path is built when the number of execution paths a workflow would
 * produce exceeds the configured ceiling.
 */
public final class PathExplosionException extends WorkflowGraphException {

    private final int decisionCount;
    private final int signalCount;
    private final long totalPaths;
    private final int ceiling;

    public PathExplosionException(int decisionCount, int signalCount, long totalPaths, int ceiling) {
        super("Workflow has " + (decisionCount + signalCount) + " branch points ("
                        + decisionCount + " decisions, " + signalCount + " signals) which would generate "
                        + totalPaths + " paths, exceeding the explosion ceiling of " + ceiling
                        + ". Raise firefly.workflow-graph.explosion-ceiling or reduce the number of branch points",
                "WORKFLOW_GRAPH_PATH_EXPLOSION",
                Map.of("decisionCount", decisionCount,
                        "signalCount", signalCount,
                        "totalPaths", totalPaths,
                        "ceiling", ceiling));
        this.decisionCount = decisionCount;
        this.signalCount = signalCount;
        this.totalPaths = totalPaths;
        this.ceiling = ceiling;
    }

    public int getDecisionCount() {
        return decisionCount;
    }

    public int getSignalCount() {
        return signalCount;
    }

    public int getBranchCount() {
        return decisionCount + signalCount;
    }

    public long getTotalPaths() {
        return totalPaths;
    }

    public int getCeiling() {
        return ceiling;
    }
}
