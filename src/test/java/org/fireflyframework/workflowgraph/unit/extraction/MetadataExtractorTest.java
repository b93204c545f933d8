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

package org.fireflyframework.workflowgraph.unit.extraction;

import com.github.javaparser.ast.CompilationUnit;
import org.fireflyframework.workflowgraph.core.exception.StructuralException;
import org.fireflyframework.workflowgraph.core.extraction.MetadataExtractor;
import org.fireflyframework.workflowgraph.core.extraction.WorkflowSourceParser;
import org.fireflyframework.workflowgraph.core.model.ActivityCall;
import org.fireflyframework.workflowgraph.core.model.ChildWorkflowCall;
import org.fireflyframework.workflowgraph.core.model.DecisionPoint;
import org.fireflyframework.workflowgraph.core.model.ExternalSignalCall;
import org.fireflyframework.workflowgraph.core.model.SignalHandlerDefinition;
import org.fireflyframework.workflowgraph.core.model.SignalPoint;
import org.fireflyframework.workflowgraph.core.model.WorkflowMetadata;
import org.fireflyframework.workflowgraph.core.options.GraphOptions;
import org.fireflyframework.workflowgraph.core.options.MarkerNames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetadataExtractorTest {

    /** First line of the entry method body produced by {@link #workflow(String...)}. */
    private static final int BODY = 5;

    private MetadataExtractor extractor;
    private WorkflowSourceParser parser;

    @BeforeEach
    void setUp() {
        extractor = new MetadataExtractor();
        parser = new WorkflowSourceParser();
    }

    // ── Entry point discovery ──────────────────────────────────────

    @Test
    void extract_linearWorkflow_recordsActivitiesInSourceOrder() {
        WorkflowMetadata metadata = extract(workflow(
                "executeActivity(\"Validate\");",
                "executeActivity(\"Charge\");"));

        assertThat(metadata.entryTypeName()).isEqualTo("SampleWorkflow");
        assertThat(metadata.entryMethodName()).isEqualTo("run");
        assertThat(metadata.entryTypeLine()).isEqualTo(2);
        assertThat(metadata.entryMethodLine()).isEqualTo(4);
        assertThat(metadata.activities()).containsExactly(
                new ActivityCall("Validate", BODY),
                new ActivityCall("Charge", BODY + 1));
        assertThat(metadata.hasBranches()).isFalse();
        assertThat(metadata.diagnostics()).isEmpty();
    }

    @Test
    void extract_emptyEntryMethod_isValid() {
        WorkflowMetadata metadata = extract(workflow());

        assertThat(metadata.isEmpty()).isTrue();
        assertThat(metadata.branchCount()).isZero();
    }

    @Test
    void extract_missingWorkflowAnnotation_throwsAtFirstTypeLine() {
        String source = lines(
                "import java.util.List;",
                "",
                "public class Plain {",
                "    public void run() {}",
                "}");

        assertThatThrownBy(() -> extract(source))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("@Workflow")
                .satisfies(e -> {
                    StructuralException se = (StructuralException) e;
                    assertThat(se.getLine()).isEqualTo(3);
                    assertThat(se.getSuggestion()).isEqualTo("annotate the workflow class with @Workflow");
                    assertThat(se.getErrorCode()).isEqualTo("WORKFLOW_GRAPH_STRUCTURAL_ERROR");
                });
    }

    @Test
    void extract_unitWithoutTypes_throwsAtLineOne() {
        assertThatThrownBy(() -> extract("package com.acme;"))
                .isInstanceOf(StructuralException.class)
                .satisfies(e -> assertThat(((StructuralException) e).getLine()).isEqualTo(1));
    }

    @Test
    void extract_missingEntryMethod_throwsAtEntryTypeLine() {
        String source = lines(
                "@Workflow",
                "public class NoEntry {",
                "    public void run() {}",
                "}");

        assertThatThrownBy(() -> extract(source))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("NoEntry")
                .satisfies(e -> {
                    StructuralException se = (StructuralException) e;
                    assertThat(se.getLine()).isEqualTo(2);
                    assertThat(se.getSuggestion()).contains("@WorkflowMethod");
                });
    }

    @Test
    void extract_qualifiedAnnotationsAndNestedType_areFound() {
        String source = lines(
                "public class Outer {",
                "    @com.acme.Workflow",
                "    static class Inner {",
                "        @com.acme.WorkflowMethod",
                "        void execute() {",
                "            executeActivity(\"Nested\");",
                "        }",
                "    }",
                "}");

        WorkflowMetadata metadata = extract(source);

        assertThat(metadata.entryTypeName()).isEqualTo("Inner");
        assertThat(metadata.entryMethodName()).isEqualTo("execute");
        assertThat(metadata.activities()).containsExactly(new ActivityCall("Nested", 6));
    }

    @Test
    void extract_customMarkerNames_areHonoured() {
        String source = lines(
                "@Orchestrated",
                "public class Custom {",
                "    @Entry",
                "    void go(boolean flag) {",
                "        if (decide(flag, \"Flag\")) {",
                "            step(\"A\");",
                "        }",
                "    }",
                "}");
        MarkerNames markers = new MarkerNames("Orchestrated", "Entry", "Handler",
                List.of("step"), List.of(), List.of(), List.of("decide"), List.of());

        WorkflowMetadata metadata = extractor.extract(parser.parse(source),
                GraphOptions.builder().markers(markers).build());

        assertThat(metadata.activities()).containsExactly(new ActivityCall("A", 6));
        assertThat(metadata.decisionPoints()).singleElement()
                .satisfies(d -> assertThat(d.trueBranchLines()).containsExactly(6));
    }

    // ── Decisions ──────────────────────────────────────────────────

    @Test
    void extract_storedBooleanDecision_capturesTrueArm() {
        WorkflowMetadata metadata = extract(workflow(
                "executeActivity(\"Withdraw\");",
                "boolean needsConversion = toDecision(amount > 100, \"NeedToConvert\");",
                "if (needsConversion) {",
                "    executeActivity(\"CurrencyConvert\");",
                "}",
                "executeActivity(\"Deposit\");"));

        DecisionPoint decision = single(metadata.decisionPoints());
        assertThat(decision.id()).isEqualTo("d0");
        assertThat(decision.displayName()).isEqualTo("NeedToConvert");
        assertThat(decision.sourceLine()).isEqualTo(BODY + 1);
        assertThat(decision.trueBranchLines()).containsExactly(BODY + 3);
        assertThat(decision.falseBranchLines()).isEmpty();
        assertThat(metadata.activities()).extracting(ActivityCall::name)
                .containsExactly("Withdraw", "CurrencyConvert", "Deposit");
        assertThat(metadata.diagnostics()).isEmpty();
    }

    @Test
    void extract_assignedBooleanDecision_capturesArms() {
        WorkflowMetadata metadata = extract(workflow(
                "boolean express;",
                "express = toDecision(amount > 5, \"Express\");",
                "if (express) {",
                "    executeActivity(\"ShipExpress\");",
                "} else {",
                "    executeActivity(\"ShipStandard\");",
                "}"));

        DecisionPoint decision = single(metadata.decisionPoints());
        assertThat(decision.trueBranchLines()).containsExactly(BODY + 3);
        assertThat(decision.falseBranchLines()).containsExactly(BODY + 5);
    }

    @Test
    void extract_directDecisionWithElse_capturesBothArms() {
        WorkflowMetadata metadata = extract(workflow(
                "if (toDecision(amount > 10, \"HighValue\")) {",
                "    executeActivity(\"ManagerApproval\");",
                "} else {",
                "    executeActivity(\"AutoApprove\");",
                "}"));

        DecisionPoint decision = single(metadata.decisionPoints());
        assertThat(decision.displayName()).isEqualTo("HighValue");
        assertThat(decision.sourceLine()).isEqualTo(BODY);
        assertThat(decision.trueBranchLines()).containsExactly(BODY + 1);
        assertThat(decision.falseBranchLines()).containsExactly(BODY + 3);
    }

    @Test
    void extract_negatedDecision_swapsArms() {
        WorkflowMetadata metadata = extract(workflow(
                "if (!(toDecision(amount > 10, \"HighValue\"))) {",
                "    executeActivity(\"AutoApprove\");",
                "} else {",
                "    executeActivity(\"ManagerApproval\");",
                "}"));

        DecisionPoint decision = single(metadata.decisionPoints());
        assertThat(decision.trueBranchLines()).containsExactly(BODY + 3);
        assertThat(decision.falseBranchLines()).containsExactly(BODY + 1);
    }

    @Test
    void extract_elseIfChain_fallsIntoFalseArmOfOuterDecision() {
        WorkflowMetadata metadata = extract(workflow(
                "if (toDecision(amount > 1000, \"Large\")) {",
                "    executeActivity(\"Audit\");",
                "} else if (toDecision(amount > 100, \"Medium\")) {",
                "    executeActivity(\"Review\");",
                "} else {",
                "    executeActivity(\"AutoApprove\");",
                "}"));

        assertThat(metadata.decisionPoints()).hasSize(2);
        DecisionPoint large = metadata.decisionPoints().get(0);
        DecisionPoint medium = metadata.decisionPoints().get(1);
        assertThat(large.id()).isEqualTo("d0");
        assertThat(large.trueBranchLines()).containsExactly(BODY + 1);
        assertThat(large.falseBranchLines()).containsExactly(BODY + 3, BODY + 5);
        assertThat(medium.id()).isEqualTo("d1");
        assertThat(medium.sourceLine()).isEqualTo(BODY + 2);
        assertThat(medium.trueBranchLines()).containsExactly(BODY + 3);
        assertThat(medium.falseBranchLines()).containsExactly(BODY + 5);
    }

    @Test
    void extract_ternaryGuardedByDecision_capturesBothArms() {
        WorkflowMetadata metadata = extract(workflow(
                "String shipment = toDecision(amount > 5, \"Express\")",
                "        ? executeActivity(\"ShipExpress\")",
                "        : executeActivity(\"ShipStandard\");"));

        DecisionPoint decision = single(metadata.decisionPoints());
        assertThat(decision.trueBranchLines()).containsExactly(BODY + 1);
        assertThat(decision.falseBranchLines()).containsExactly(BODY + 2);
    }

    @Test
    void extract_nestedConditionals_recordLinesInEveryEnclosingBranch() {
        WorkflowMetadata metadata = extract(workflow(
                "if (toDecision(amount > 0, \"Outer\")) {",
                "    executeActivity(\"A\");",
                "    if (toDecision(amount > 10, \"Inner\")) {",
                "        executeActivity(\"B\");",
                "    }",
                "}"));

        DecisionPoint outer = metadata.decisionPoints().get(0);
        DecisionPoint inner = metadata.decisionPoints().get(1);
        assertThat(outer.trueBranchLines()).containsExactly(BODY + 1, BODY + 3);
        assertThat(outer.falseBranchLines()).isEmpty();
        assertThat(inner.trueBranchLines()).containsExactly(BODY + 3);
        assertThat(inner.falseBranchLines()).isEmpty();
    }

    @Test
    void extract_conditionNotGuardedByMarker_capturesNothing() {
        WorkflowMetadata metadata = extract(workflow(
                "boolean approved = toDecision(amount > 1, \"Approved\");",
                "if (amount > 50) {",
                "    executeActivity(\"Review\");",
                "}"));

        DecisionPoint decision = single(metadata.decisionPoints());
        assertThat(decision.isUnscoped()).isTrue();
        assertThat(metadata.activities()).containsExactly(new ActivityCall("Review", BODY + 2));
    }

    @Test
    void extract_reassignedBoolean_noLongerGuards() {
        WorkflowMetadata metadata = extract(workflow(
                "boolean approved = toDecision(amount > 1, \"Approved\");",
                "approved = amount > 5;",
                "if (approved) {",
                "    executeActivity(\"A\");",
                "}"));

        assertThat(single(metadata.decisionPoints()).isUnscoped()).isTrue();
        assertThat(metadata.diagnostics()).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("does not guard any conditional"));
    }

    @Test
    void extract_bindingDoesNotLeakOutOfBlock() {
        WorkflowMetadata metadata = extract(workflow(
                "boolean approved = amount > 0;",
                "{",
                "    approved = toDecision(amount > 1, \"Approved\");",
                "}",
                "if (approved) {",
                "    executeActivity(\"A\");",
                "}"));

        assertThat(single(metadata.decisionPoints()).isUnscoped()).isTrue();
    }

    @Test
    void extract_unguardedMarker_recordsDiagnostic() {
        WorkflowMetadata metadata = extract(workflow(
                "boolean flag = toDecision(amount > 1, \"Unused\");",
                "executeActivity(\"A\");"));

        assertThat(single(metadata.decisionPoints()).isUnscoped()).isTrue();
        assertThat(metadata.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.marker()).isEqualTo("toDecision");
            assertThat(d.sourceLine()).isEqualTo(BODY);
            assertThat(d.message()).contains("Unused");
        });
    }

    // ── Fallback names ─────────────────────────────────────────────

    @Test
    void extract_nonLiteralNames_fallBackWithDiagnostics() {
        WorkflowMetadata metadata = extract(workflow(
                "String name = \"X\";",
                "executeActivity(name + \"Suffix\");",
                "if (toDecision(amount > 1, name)) {",
                "    executeActivity(\"Y\");",
                "}",
                "if (waitCondition(() -> true, timeout)) {",
                "    executeActivity(\"Z\");",
                "}"));

        assertThat(metadata.activities()).extracting(ActivityCall::name)
                .containsExactly("activityL" + (BODY + 1), "Y", "Z");
        assertThat(single(metadata.decisionPoints()).displayName()).isEqualTo("runDecision0");
        assertThat(metadata.signalPoints()).singleElement()
                .satisfies(s -> assertThat(s.displayName()).isEqualTo("runSignal0"));
        assertThat(metadata.diagnostics()).extracting(d -> d.sourceLine())
                .containsExactly(BODY + 1, BODY + 2, BODY + 5);
        assertThat(metadata.diagnostics().get(1).format())
                .startsWith("Line " + (BODY + 2) + " [toDecision]: ")
                .contains("NameExpr");
    }

    @Test
    void extract_activityReferences_resolveToMethodOrTypeName() {
        WorkflowMetadata metadata = extract(workflow(
                "executeActivity(OrderActivities::reserveStock, amount);",
                "executeLocalActivity(ChargeCard.class);",
                "executeActivity(NOTIFY_CUSTOMER);"));

        assertThat(metadata.activities()).extracting(ActivityCall::name)
                .containsExactly("reserveStock", "ChargeCard", "NOTIFY_CUSTOMER");
        assertThat(metadata.diagnostics()).isEmpty();
    }

    // ── Signals, child workflows, external signals ─────────────────

    @Test
    void extract_waitCondition_becomesSignalPoint() {
        WorkflowMetadata metadata = extract(workflow(
                "if (waitCondition(() -> approved, Duration.ofHours(1), \"Approval\")) {",
                "    executeActivity(\"Ship\");",
                "} else {",
                "    executeActivity(\"Cancel\");",
                "}"));

        assertThat(metadata.decisionPoints()).isEmpty();
        SignalPoint signal = single(metadata.signalPoints());
        assertThat(signal.id()).isEqualTo("sig0");
        assertThat(signal.displayName()).isEqualTo("Approval");
        assertThat(signal.signaledBranchLines()).containsExactly(BODY + 1);
        assertThat(signal.timeoutBranchLines()).containsExactly(BODY + 3);
    }

    @Test
    void extract_childWorkflowsAndExternalSignals_areRecorded() {
        WorkflowMetadata metadata = extract(workflow(
                "executeChildWorkflow(PaymentWorkflow.class, amount);",
                "executeChildWorkflow(\"ShippingWorkflow\");",
                "signalExternalWorkflow(\"order-\" + orderId + \"-shipping\", \"ShipmentReady\");",
                "signalExternalWorkflow(targetId, \"Cancelled\");",
                "signalExternalWorkflow(\"billing\", \"Invoice\");"));

        assertThat(metadata.childWorkflowCalls()).containsExactly(
                new ChildWorkflowCall("PaymentWorkflow", BODY),
                new ChildWorkflowCall("ShippingWorkflow", BODY + 1));
        assertThat(metadata.externalSignalCalls()).containsExactly(
                new ExternalSignalCall("ShipmentReady", "order-{*}-shipping", BODY + 2),
                new ExternalSignalCall("Cancelled", ExternalSignalCall.DYNAMIC_TARGET, BODY + 3),
                new ExternalSignalCall("Invoice", "billing", BODY + 4));
    }

    @Test
    void extract_callsInsideBranch_areScopedLikeActivities() {
        WorkflowMetadata metadata = extract(workflow(
                "if (toDecision(amount > 1, \"Split\")) {",
                "    executeChildWorkflow(\"Settlement\");",
                "} else {",
                "    signalExternalWorkflow(\"ledger\", \"Skip\");",
                "}"));

        DecisionPoint decision = single(metadata.decisionPoints());
        assertThat(decision.trueBranchLines()).containsExactly(BODY + 1);
        assertThat(decision.falseBranchLines()).containsExactly(BODY + 3);
    }

    @Test
    void extract_signalHandlers_readNameFromAnnotationOrMethod() {
        String source = lines(
                "@Workflow",
                "public class SignalWorkflow {",
                "    @SignalMethod(\"approve\")",
                "    public void onApprove() {}",
                "    @SignalMethod(value = \"reject\")",
                "    public void onReject() {}",
                "    @SignalMethod",
                "    public void cancel() {}",
                "    @WorkflowMethod",
                "    public void run() {",
                "        executeActivity(\"A\");",
                "    }",
                "}");

        WorkflowMetadata metadata = extract(source);

        assertThat(metadata.signalHandlers()).containsExactly(
                new SignalHandlerDefinition("approve", "onApprove", 4),
                new SignalHandlerDefinition("reject", "onReject", 6),
                new SignalHandlerDefinition("cancel", "cancel", 8));
    }

    // ── Purity ─────────────────────────────────────────────────────

    @Test
    void extract_isIdempotentAndLeavesTreeUntouched() {
        CompilationUnit unit = parser.parse(workflow(
                "if (toDecision(amount > 10, \"HighValue\")) {",
                "    executeActivity(\"ManagerApproval\");",
                "}",
                "executeActivity(\"Archive\");"));
        String before = unit.toString();

        WorkflowMetadata first = extractor.extract(unit);
        WorkflowMetadata second = extractor.extract(unit);

        assertThat(second).isEqualTo(first);
        assertThat(unit.toString()).isEqualTo(before);
    }

    // ── Helpers ────────────────────────────────────────────────────

    private WorkflowMetadata extract(String source) {
        return extractor.extract(parser.parse(source));
    }

    private static <T> T single(List<T> items) {
        assertThat(items).hasSize(1);
        return items.get(0);
    }

    private static String workflow(String... body) {
        List<String> lines = new ArrayList<>();
        lines.add("@Workflow");
        lines.add("public class SampleWorkflow {");
        lines.add("    @WorkflowMethod");
        lines.add("    public void run(int amount) {");
        for (String line : body) {
            lines.add("        " + line);
        }
        lines.add("    }");
        lines.add("}");
        return String.join("\n", lines);
    }

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }
}
