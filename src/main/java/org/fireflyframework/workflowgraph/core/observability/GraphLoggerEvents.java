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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.workflowgraph.core.options.OutputMode;

@Slf4j
public class GraphLoggerEvents implements GraphEvents {
    @Override
    public void onExtracted(String workflow, int activities, int branchPoints, int diagnostics) {
        log.info("[workflow-graph] extracted workflow={} activities={} branchPoints={} diagnostics={}", workflow, activities, branchPoints, diagnostics);
    }
    @Override
    public void onPathsGenerated(String workflow, int branchPoints, int paths) {
        log.info("[workflow-graph] paths.generated workflow={} branchPoints={} paths={}", workflow, branchPoints, paths);
    }
    @Override
    public void onPathExplosion(String workflow, int branchPoints, long totalPaths, int ceiling) {
        log.warn("[workflow-graph] paths.explosion workflow={} branchPoints={} totalPaths={} ceiling={}", workflow, branchPoints, totalPaths, ceiling);
    }
    @Override
    public void onValidated(String workflow, int warnings, int infos) {
        log.info("[workflow-graph] validated workflow={} warnings={} infos={}", workflow, warnings, infos);
    }
    @Override
    public void onCompleted(String workflow, OutputMode mode, long durationMs) {
        log.info("[workflow-graph] completed workflow={} mode={} durationMs={}", workflow, mode, durationMs);
    }
    @Override
    public void onFailed(String workflow, Throwable error, long durationMs) {
        log.error("[workflow-graph] failed workflow={} durationMs={} error={}", workflow, durationMs, error.getMessage());
    }
}
