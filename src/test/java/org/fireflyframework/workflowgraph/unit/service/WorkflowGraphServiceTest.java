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

package org.fireflyframework.workflowgraph.unit.service;

import org.fireflyframework.workflowgraph.core.exception.PathExplosionException;
import org.fireflyframework.workflowgraph.core.exception.StructuralException;
import org.fireflyframework.workflowgraph.core.extraction.MetadataExtractor;
import org.fireflyframework.workflowgraph.core.extraction.WorkflowSourceParser;
import org.fireflyframework.workflowgraph.core.observability.GraphEvents;
import org.fireflyframework.workflowgraph.core.options.GraphOptions;
import org.fireflyframework.workflowgraph.core.options.OutputMode;
import org.fireflyframework.workflowgraph.core.path.PathPermutationGenerator;
import org.fireflyframework.workflowgraph.core.render.DiagramRenderer;
import org.fireflyframework.workflowgraph.core.render.PathListFormatter;
import org.fireflyframework.workflowgraph.core.validation.GraphValidator;
import org.fireflyframework.workflowgraph.core.validation.ValidationIssue;
import org.fireflyframework.workflowgraph.service.WorkflowGraphResult;
import org.fireflyframework.workflowgraph.service.WorkflowGraphService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class WorkflowGraphServiceTest {

    private static final String ORDER_WORKFLOW = String.join("\n",
            "@Workflow",
            "public class OrderWorkflow {",
            "    @WorkflowMethod",
            "    public void run() {",
            "        executeActivity(\"ReserveStock\");",
            "        if (toDecision(isPriority(), \"isPriority\")) {",
            "            executeActivity(\"ShipExpress\");",
            "        } else {",
            "            executeActivity(\"ShipStandard\");",
            "        }",
            "    }",
            "}");

    private static final String EXPECTED_DIAGRAM = String.join("\n",
            "```mermaid",
            "flowchart LR",
            "s((Start))",
            "ReserveStock_5[Reserve Stock]",
            "d0{is Priority}",
            "ShipExpress_7[Ship Express]",
            "ShipStandard_9[Ship Standard]",
            "e((End))",
            "s --> ReserveStock_5",
            "ReserveStock_5 --> d0",
            "d0 -- yes --> ShipExpress_7",
            "ShipExpress_7 --> e",
            "d0 -- no --> ShipStandard_9",
            "ShipStandard_9 --> e",
            "```");

    private static final String EXPECTED_PATH_LIST = String.join("\n",
            "--- Execution Paths (2 total) ---",
            "Branch Points: 1 (2^1 = 2 paths)",
            "",
            "Path 1: Start → Reserve Stock → Ship Express → End",
            "Path 2: Start → Reserve Stock → Ship Standard → End");

    private GraphEvents events;
    private WorkflowGraphService service;

    @BeforeEach
    void setUp() {
        events = mock(GraphEvents.class);
        service = new WorkflowGraphService(new WorkflowSourceParser(), new MetadataExtractor(),
                new PathPermutationGenerator(), new GraphValidator(), new DiagramRenderer(),
                new PathListFormatter(), events, GraphOptions.defaults());
    }

    // ── End to end ─────────────────────────────────────────────────

    @Test
    void analyze_bothMode_emitsDiagramThenPathList() {
        WorkflowGraphResult result = service.analyze(ORDER_WORKFLOW);

        assertThat(result.workflowName()).isEqualTo("OrderWorkflow");
        assertThat(result.paths()).hasSize(2);
        assertThat(result.validationReport().hasIssues()).isFalse();
        assertThat(result.output()).isEqualTo(EXPECTED_DIAGRAM + "\n\n" + EXPECTED_PATH_LIST);
    }

    @Test
    void analyze_diagramMode_omitsPathList() {
        WorkflowGraphResult result = service.analyze(ORDER_WORKFLOW,
                GraphOptions.builder().outputMode(OutputMode.DIAGRAM).build());

        assertThat(result.output()).isEqualTo(EXPECTED_DIAGRAM);
    }

    @Test
    void analyze_pathListMode_omitsDiagram() {
        WorkflowGraphResult result = service.analyze(ORDER_WORKFLOW,
                GraphOptions.builder().outputMode("path-list").build());

        assertThat(result.output()).isEqualTo(EXPECTED_PATH_LIST);
    }

    @Test
    void analyze_pathListModeWithPathListDisabled_isEmpty() {
        WorkflowGraphResult result = service.analyze(ORDER_WORKFLOW,
                GraphOptions.builder().outputMode(OutputMode.PATH_LIST).includePathList(false).build());

        assertThat(result.output()).isEmpty();
        assertThat(result.paths()).hasSize(2);
    }

    @Test
    void analyze_sameSourceTwice_producesIdenticalOutput() {
        String first = service.analyze(ORDER_WORKFLOW).output();
        String second = new WorkflowGraphService().analyze(ORDER_WORKFLOW).output();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void analyze_compilationUnit_matchesSourceAnalysis() {
        var unit = new WorkflowSourceParser().parse(ORDER_WORKFLOW);

        assertThat(service.analyze(unit).output()).isEqualTo(service.analyze(ORDER_WORKFLOW).output());
    }

    // ── Validation report ──────────────────────────────────────────

    @Test
    void analyze_emptyWorkflow_appendsValidationReport() {
        String source = String.join("\n",
                "@Workflow",
                "public class IdleWorkflow {",
                "    @WorkflowMethod",
                "    public void run() {",
                "    }",
                "}");

        WorkflowGraphResult result = service.analyze(source);

        assertThat(result.validationReport().issuesOf(ValidationIssue.Category.EMPTY)).hasSize(1);
        assertThat(result.output())
                .startsWith("```mermaid\nflowchart LR\ns((Start))\ne((End))\ns --> e\n```")
                .contains("--- Validation Report ---")
                .contains("[WARNING] [EMPTY] Workflow calls no activities, child workflows or external signals at IdleWorkflow.run:4");
    }

    @Test
    void analyze_reportDisabled_keepsIssuesOutOfOutput() {
        String source = String.join("\n",
                "@Workflow",
                "public class IdleWorkflow {",
                "    @WorkflowMethod",
                "    public void run() {",
                "    }",
                "}");

        WorkflowGraphResult result = service.analyze(source,
                GraphOptions.builder().includeValidationReport(false).build());

        assertThat(result.validationReport().hasIssues()).isTrue();
        assertThat(result.output()).doesNotContain("Validation Report");
    }

    // ── Events ─────────────────────────────────────────────────────

    @Test
    void analyze_success_firesStageEventsInOrder() {
        service.analyze(ORDER_WORKFLOW);

        var inOrder = inOrder(events);
        inOrder.verify(events).onExtracted("OrderWorkflow", 3, 1, 0);
        inOrder.verify(events).onPathsGenerated("OrderWorkflow", 1, 2);
        inOrder.verify(events).onValidated("OrderWorkflow", 0, 0);
        inOrder.verify(events).onCompleted(eq("OrderWorkflow"), eq(OutputMode.BOTH), anyLong());
        verify(events, never()).onFailed(anyString(), any(), anyLong());
    }

    @Test
    void analyze_tooManyBranches_refusesAndReportsExplosion() {
        String source = String.join("\n",
                "@Workflow",
                "public class WideWorkflow {",
                "    @WorkflowMethod",
                "    public void run() {",
                "        if (toDecision(a(), \"first\")) { executeActivity(\"A\"); }",
                "        if (toDecision(b(), \"second\")) { executeActivity(\"B\"); }",
                "    }",
                "}");
        GraphOptions options = GraphOptions.builder().explosionCeiling(2).build();

        assertThatThrownBy(() -> service.analyze(source, options))
                .isInstanceOf(PathExplosionException.class)
                .hasMessageContaining("would generate 4 paths")
                .hasMessageContaining("explosion ceiling of 2");

        verify(events).onPathExplosion("WideWorkflow", 2, 4L, 2);
        verify(events).onFailed(eq("WideWorkflow"), any(PathExplosionException.class), anyLong());
        verify(events, never()).onCompleted(anyString(), any(), anyLong());
    }

    @Test
    void analyze_unparseableSource_failsWithStructuralError() {
        assertThatThrownBy(() -> service.analyze("public class {"))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("does not parse");

        verify(events).onFailed(eq("<unknown>"), any(StructuralException.class), anyLong());
    }

    @Test
    void analyze_missingEntryMethod_failsWithWorkflowName() {
        String source = String.join("\n",
                "@Workflow",
                "public class HalfWorkflow {",
                "    public void run() {}",
                "}");

        assertThatThrownBy(() -> service.analyze(source)).isInstanceOf(StructuralException.class);

        verify(events).onFailed(eq("<unknown>"), any(StructuralException.class), anyLong());
    }

    @Test
    void analyze_extractorFailsUnexpectedly_reportsFailureAndRethrows() {
        MetadataExtractor extractor = mock(MetadataExtractor.class);
        when(extractor.extract(any(), any())).thenThrow(new IllegalStateException("boom"));
        WorkflowGraphService failing = new WorkflowGraphService(new WorkflowSourceParser(), extractor,
                new PathPermutationGenerator(), new GraphValidator(), new DiagramRenderer(),
                new PathListFormatter(), events, GraphOptions.defaults());

        assertThatThrownBy(() -> failing.analyze(ORDER_WORKFLOW))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");

        verify(events).onFailed(eq("<unknown>"), any(IllegalStateException.class), anyLong());
        verify(events, never()).onCompleted(anyString(), any(), anyLong());
    }

    @Test
    void analyze_rendererFailsUnexpectedly_reportsFailureWithWorkflowName() {
        DiagramRenderer renderer = mock(DiagramRenderer.class);
        when(renderer.render(anyList(), any(GraphOptions.class))).thenThrow(new IllegalArgumentException("bad label"));
        WorkflowGraphService failing = new WorkflowGraphService(new WorkflowSourceParser(), new MetadataExtractor(),
                new PathPermutationGenerator(), new GraphValidator(), renderer,
                new PathListFormatter(), events, GraphOptions.defaults());

        assertThatThrownBy(() -> failing.analyze(ORDER_WORKFLOW)).isInstanceOf(IllegalArgumentException.class);

        verify(events).onExtracted(eq("OrderWorkflow"), anyInt(), anyInt(), anyInt());
        verify(events).onFailed(eq("OrderWorkflow"), any(IllegalArgumentException.class), anyLong());
    }
}
