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

package org.fireflyframework.workflowgraph.core.render;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.workflowgraph.core.model.PathStep;
import org.fireflyframework.workflowgraph.core.model.StepKind;
import org.fireflyframework.workflowgraph.core.options.ExternalSignalLabelStyle;
import org.fireflyframework.workflowgraph.core.options.GraphOptions;
import org.fireflyframework.workflowgraph.core.path.ExecutionPath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders execution paths as one Mermaid {@code flowchart LR}.
 *
 * <p>Rendering runs in two passes. The first collects node definitions into an
 * insertion-ordered map keyed by node id (first definition wins) and edges into an
 * insertion-ordered set, so a node or edge shared by several paths is emitted once.
 * The second writes Start, every other node in first-seen order, End, and then every
 * edge. Nodes and edges never interleave.
 */
@Slf4j
public class DiagramRenderer {

    static final String START_ID = "s";
    static final String END_ID = "e";
    private static final String EXTERNAL_SIGNAL_STYLE = "fill:#fff4e6,stroke:#ffa500";

    public String render(List<ExecutionPath> paths) {
        return render(paths, GraphOptions.defaults());
    }

    public String render(List<ExecutionPath> paths, GraphOptions options) {
        Map<String, String> nodes = new LinkedHashMap<>();
        Set<DiagramEdge> edges = new LinkedHashSet<>();
        List<String> externalSignalNodes = new ArrayList<>();

        for (ExecutionPath path : paths) {
            String previous = START_ID;
            String previousLabel = null;
            boolean previousIsSignal = false;
            for (PathStep step : path.steps()) {
                String id = nodeId(step);
                if (!nodes.containsKey(id)) {
                    nodes.put(id, nodeDefinition(id, step, options));
                    if (step.kind() == StepKind.EXTERNAL_SIGNAL) {
                        externalSignalNodes.add(id);
                    }
                }
                boolean isSignal = step.kind() == StepKind.EXTERNAL_SIGNAL;
                // Edges into and out of an external signal node are dotted.
                edges.add(new DiagramEdge(previous, id, previousLabel, previousIsSignal || isSignal));
                previous = id;
                previousLabel = outcomeLabel(step, path, options);
                previousIsSignal = isSignal;
            }
            edges.add(new DiagramEdge(previous, END_ID, previousLabel, previousIsSignal));
        }
        if (paths.isEmpty()) {
            edges.add(new DiagramEdge(START_ID, END_ID, null, false));
        }

        List<String> lines = new ArrayList<>(nodes.size() + edges.size() + 6);
        lines.add("```mermaid");
        lines.add("flowchart LR");
        lines.add(START_ID + "((" + options.startLabel() + "))");
        lines.addAll(nodes.values());
        lines.add(END_ID + "((" + options.endLabel() + "))");
        for (DiagramEdge edge : edges) {
            lines.add(edge.toMermaid());
        }
        for (String id : externalSignalNodes) {
            lines.add("style " + id + " " + EXTERNAL_SIGNAL_STYLE);
        }
        lines.add("```");

        log.debug("[workflow-graph] diagram.rendered paths={} nodes={} edges={}",
                paths.size(), nodes.size() + 2, edges.size());
        return String.join("\n", lines);
    }

    static String nodeId(PathStep step) {
        return switch (step.kind()) {
            case ACTIVITY -> DisplayNames.sanitizeId(step.name()) + "_" + step.sourceLine();
            case DECISION -> ((PathStep.DecisionOutcomeStep) step).branchId();
            case SIGNAL -> ((PathStep.SignalOutcomeStep) step).branchId();
            case CHILD_WORKFLOW -> "child_" + DisplayNames.lowerCaseId(step.name()) + "_" + step.sourceLine();
            case EXTERNAL_SIGNAL -> "ext_sig_" + DisplayNames.sanitizeId(step.name()) + "_" + step.sourceLine();
        };
    }

    private static String nodeDefinition(String id, PathStep step, GraphOptions options) {
        String label = DisplayNames.label(step.name(), options.splitDisplayNames());
        return switch (step.kind()) {
            case ACTIVITY -> id + "[" + DisplayNames.nodeText(label) + "]";
            case DECISION -> id + "{" + DisplayNames.nodeText(label) + "}";
            case SIGNAL -> id + "{{" + DisplayNames.nodeText(label) + "}}";
            case CHILD_WORKFLOW -> id + "[[" + DisplayNames.nodeText(label) + "]]";
            case EXTERNAL_SIGNAL -> id + "[/" + DisplayNames.nodeText(externalSignalText(step, label, options)) + "\\]";
        };
    }

    private static String externalSignalText(PathStep step, String label, GraphOptions options) {
        String text = "Signal '" + label + "'";
        if (options.externalSignalLabelStyle() == ExternalSignalLabelStyle.TARGET_PATTERN) {
            return text + " to " + ((PathStep.ExternalSignalStep) step).targetPattern();
        }
        return text;
    }

    /** Label for the edge leaving {@code step}, or {@code null} when the step is not a branch. */
    private static String outcomeLabel(PathStep step, ExecutionPath path, GraphOptions options) {
        if (step instanceof PathStep.DecisionOutcomeStep decision) {
            return options.outcomeLabel(false, path.outcomeOf(decision.branchId()));
        }
        if (step instanceof PathStep.SignalOutcomeStep signal) {
            return options.outcomeLabel(true, path.outcomeOf(signal.branchId()));
        }
        return null;
    }
}
