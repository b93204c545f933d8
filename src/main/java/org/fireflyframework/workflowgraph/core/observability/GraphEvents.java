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

package org.fireflyframework.workflowgraph.core.observability;

import org.fireflyframework.workflowgraph.core.options.OutputMode;

public interface GraphEvents {
    // Pipeline stages
    default void onExtracted(String workflow, int activities, int branchPoints, int diagnostics) {}
    default void onPathsGenerated(String workflow, int branchPoints, int paths) {}
    default void onPathExplosion(String workflow, int branchPoints, long totalPaths, int ceiling) {}
    default void onValidated(String workflow, int warnings, int infos) {}

    // Outcome
    default void onCompleted(String workflow, OutputMode mode, long durationMs) {}
    default void onFailed(String workflow, Throwable error, long durationMs) {}
}
