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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.workflowgraph.core.options.OutputMode;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class GraphMetrics implements GraphEvents {
    static final String PREFIX = "firefly.workflow-graph";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DistributionSummary> summaries = new ConcurrentHashMap<>();

    public GraphMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onExtracted(String workflow, int activities, int branchPoints, int diagnostics) {
        counter("marker.diagnostics", "workflow", workflow).increment(diagnostics);
    }

    @Override
    public void onPathsGenerated(String workflow, int branchPoints, int paths) {
        summary("paths.generated", "workflow", workflow).record(paths);
    }

    @Override
    public void onPathExplosion(String workflow, int branchPoints, long totalPaths, int ceiling) {
        counter("paths.refused", "workflow", workflow).increment();
    }

    @Override
    public void onCompleted(String workflow, OutputMode mode, long durationMs) {
        counter("analyses.completed", "workflow", workflow, "success", "true").increment();
        timer("analyses.duration", "workflow", workflow, "mode", mode.name()).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onFailed(String workflow, Throwable error, long durationMs) {
        counter("analyses.completed", "workflow", workflow, "success", "false").increment();
        counter("analyses.errors", "workflow", workflow, "error", error.getClass().getSimpleName()).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private DistributionSummary summary(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return summaries.computeIfAbsent(key, k -> DistributionSummary.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
