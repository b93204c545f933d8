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

package org.fireflyframework.workflowgraph.service;

import org.fireflyframework.workflowgraph.core.model.WorkflowMetadata;
import org.fireflyframework.workflowgraph.core.path.ExecutionPath;
import org.fireflyframework.workflowgraph.core.validation.ValidationReport;

import java.util.List;

/**
 * Everything one analysis produced. {@code output} is the composed text for the configured
 * output mode; the other components let callers inspect the intermediate results.
 */
public record WorkflowGraphResult(WorkflowMetadata metadata,
                                  List<ExecutionPath> paths,
                                  ValidationReport validationReport,
                                  String output) {

    public WorkflowGraphResult {
        paths = List.copyOf(paths);
    }

    public String workflowName() {
        return metadata.entryTypeName();
    }
}
