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

import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeGraphEvents implements GraphEvents {
    private final List<GraphEvents> delegates;

    public CompositeGraphEvents(List<GraphEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<GraphEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onExtracted(String workflow, int activities, int branchPoints, int diagnostics) { safeForEach(d -> d.onExtracted(workflow, activities, branchPoints, diagnostics)); }
    @Override public void onPathsGenerated(String workflow, int branchPoints, int paths) { safeForEach(d -> d.onPathsGenerated(workflow, branchPoints, paths)); }
    @Override public void onPathExplosion(String workflow, int branchPoints, long totalPaths, int ceiling) { safeForEach(d -> d.onPathExplosion(workflow, branchPoints, totalPaths, ceiling)); }
    @Override public void onValidated(String workflow, int warnings, int infos) { safeForEach(d -> d.onValidated(workflow, warnings, infos)); }
    @Override public void onCompleted(String workflow, OutputMode mode, long durationMs) { safeForEach(d -> d.onCompleted(workflow, mode, durationMs)); }
    @Override public void onFailed(String workflow, Throwable error, long durationMs) { safeForEach(d -> d.onFailed(workflow, error, durationMs)); }
}
