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
 * Raised when two branch points of one workflow share an id. Path outcomes are keyed by
 * branch point id, so a repeated id would collapse distinct paths into one.
 */
public final class DuplicateBranchPointException extends WorkflowGraphException {

    private final String branchId;

    public DuplicateBranchPointException(String workflow, String branchId) {
        super("Workflow '" + workflow + "' declares branch point id '" + branchId
                        + "' more than once; ids must be unique across decisions and signals",
                "WORKFLOW_GRAPH_DUPLICATE_BRANCH_POINT",
                Map.of("workflow", workflow, "branchId", branchId));
        this.branchId = branchId;
    }

    public String getBranchId() {
        return branchId;
    }
}
