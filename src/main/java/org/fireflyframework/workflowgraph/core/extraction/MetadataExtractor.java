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

package org.fireflyframework.workflowgraph.core.extraction;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.Statement;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.workflowgraph.core.exception.StructuralException;
import org.fireflyframework.workflowgraph.core.model.ActivityCall;
import org.fireflyframework.workflowgraph.core.model.ChildWorkflowCall;
import org.fireflyframework.workflowgraph.core.model.DecisionPoint;
import org.fireflyframework.workflowgraph.core.model.ExternalSignalCall;
import org.fireflyframework.workflowgraph.core.model.MarkerDiagnostic;
import org.fireflyframework.workflowgraph.core.model.SignalHandlerDefinition;
import org.fireflyframework.workflowgraph.core.model.SignalPoint;
import org.fireflyframework.workflowgraph.core.model.WorkflowMetadata;
import org.fireflyframework.workflowgraph.core.options.GraphOptions;
import org.fireflyframework.workflowgraph.core.options.MarkerNames;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Walks a parsed workflow class and produces its {@link WorkflowMetadata}.
 *
 * <p>The entry type is the first type declaration, in pre-order, annotated with the workflow
 * type marker; the entry method is its first method annotated with the entry method marker.
 * The body of that method is walked depth-first in source order. Call markers are recorded
 * with their line; decision and signal markers become branch points. When an {@code if}
 * statement or a ternary is guarded by a branch point (directly, negated, or through a
 * boolean local bound to it), the lines of the calls in each arm are added to the matching
 * line set of that branch point and of every enclosing one.
 *
 * <p>Stateless and thread-safe. The tree is never mutated.
 */
@Slf4j
public class MetadataExtractor {

    private static final Comparator<Node> SOURCE_ORDER = Comparator.comparing(
            (Node node) -> node.getBegin().map(p -> p.line).orElse(0))
            .thenComparing(node -> node.getBegin().map(p -> p.column).orElse(0));

    public WorkflowMetadata extract(CompilationUnit unit) {
        return extract(unit, GraphOptions.defaults());
    }

    public WorkflowMetadata extract(CompilationUnit unit, GraphOptions options) {
        MarkerNames markers = options.markers();
        TypeDeclaration<?> entryType = findEntryType(unit, markers);
        MethodDeclaration entryMethod = findEntryMethod(entryType, markers);
        BlockStmt body = entryMethod.getBody().orElseThrow(() -> new StructuralException(
                "entry method '" + entryMethod.getNameAsString() + "' has no body",
                nameLine(entryMethod),
                "annotate the implementing method with @" + markers.entryMethod()));

        String typeName = entryType.getNameAsString();
        String methodName = entryMethod.getNameAsString();
        log.debug("[workflow-graph] extraction.started workflow={} method={} line={}",
                typeName, methodName, nameLine(entryMethod));

        Collector collector = new Collector(markers, typeName);
        walk(body, TraversalState.root(methodName), collector);
        collector.reportUnguardedBranches();

        WorkflowMetadata metadata = new WorkflowMetadata(
                typeName,
                methodName,
                nameLine(entryType),
                nameLine(entryMethod),
                collector.activities,
                collector.decisionPoints(),
                collector.signalPoints(),
                collector.childWorkflowCalls,
                collector.externalSignalCalls,
                signalHandlers(entryType, markers),
                collector.diagnostics);

        log.debug("[workflow-graph] extraction.completed workflow={} method={} activities={} decisions={} signals={} "
                        + "childWorkflows={} externalSignals={} diagnostics={}",
                typeName, methodName, metadata.activities().size(), metadata.decisionPoints().size(),
                metadata.signalPoints().size(), metadata.childWorkflowCalls().size(),
                metadata.externalSignalCalls().size(), metadata.diagnostics().size());
        return metadata;
    }

    // ── Entry point discovery ────────────────────────────────────────

    private TypeDeclaration<?> findEntryType(CompilationUnit unit, MarkerNames markers) {
        List<TypeDeclaration<?>> types = new ArrayList<>();
        unit.walk(TypeDeclaration.class, types::add);
        return types.stream()
                .filter(type -> hasAnnotation(type.getAnnotations(), markers.workflowType()))
                .findFirst()
                .orElseThrow(() -> new StructuralException(
                        "no type annotated with @" + markers.workflowType() + " found",
                        types.isEmpty() ? 1 : nameLine(types.get(0)),
                        "annotate the workflow class with @" + markers.workflowType()));
    }

    private MethodDeclaration findEntryMethod(TypeDeclaration<?> type, MarkerNames markers) {
        return type.getMethods().stream()
                .filter(method -> hasAnnotation(method.getAnnotations(), markers.entryMethod()))
                .findFirst()
                .orElseThrow(() -> new StructuralException(
                        "workflow type '" + type.getNameAsString() + "' has no method annotated with @"
                                + markers.entryMethod(),
                        nameLine(type),
                        "annotate the entry method with @" + markers.entryMethod()));
    }

    private List<SignalHandlerDefinition> signalHandlers(TypeDeclaration<?> type, MarkerNames markers) {
        List<SignalHandlerDefinition> handlers = new ArrayList<>();
        for (MethodDeclaration method : type.getMethods()) {
            for (AnnotationExpr annotation : method.getAnnotations()) {
                if (markers.isSignalHandler(annotation.getNameAsString())) {
                    String signalName = annotatedSignalName(annotation).orElse(method.getNameAsString());
                    handlers.add(new SignalHandlerDefinition(signalName, method.getNameAsString(), nameLine(method)));
                    log.debug("[workflow-graph] marker.signal-handler signal={} method={}",
                            signalName, method.getNameAsString());
                }
            }
        }
        return handlers;
    }

    private static Optional<String> annotatedSignalName(AnnotationExpr annotation) {
        if (annotation instanceof SingleMemberAnnotationExpr single) {
            return MarkerArguments.literal(single.getMemberValue()).filter(s -> !s.isBlank());
        }
        if (annotation instanceof NormalAnnotationExpr normal) {
            for (MemberValuePair pair : normal.getPairs()) {
                String key = pair.getNameAsString();
                if ("name".equals(key) || "value".equals(key)) {
                    Optional<String> name = MarkerArguments.literal(pair.getValue()).filter(s -> !s.isBlank());
                    if (name.isPresent()) {
                        return name;
                    }
                }
            }
        }
        return Optional.empty();
    }

    private static boolean hasAnnotation(List<AnnotationExpr> annotations, String marker) {
        return annotations.stream()
                .anyMatch(a -> marker.equals(MarkerNames.simpleName(a.getNameAsString())));
    }

    // ── Body traversal ───────────────────────────────────────────────

    /**
     * Visits {@code node} and returns the state that applies to the node's following siblings.
     * Blocks and conditionals return the state they were given, so bindings never leak out
     * of the block that declares them.
     */
    private TraversalState walk(Node node, TraversalState state, Collector collector) {
        if (node instanceof BlockStmt block) {
            TraversalState inner = state;
            for (Statement statement : block.getStatements()) {
                inner = walk(statement, inner, collector);
            }
            return state;
        }
        if (node instanceof IfStmt ifStmt) {
            walkConditional(ifStmt.getCondition(), ifStmt.getThenStmt(),
                    ifStmt.getElseStmt().orElse(null), state, collector);
            return state;
        }
        if (node instanceof ConditionalExpr ternary) {
            walkConditional(ternary.getCondition(), ternary.getThenExpr(), ternary.getElseExpr(),
                    state, collector);
            return state;
        }
        if (node instanceof MethodCallExpr call) {
            collector.record(call, state);
            return walkChildren(call, state, collector);
        }
        if (node instanceof VariableDeclarator declarator) {
            TraversalState after = walkChildren(declarator, state, collector);
            Optional<String> branchId = declarator.getInitializer().flatMap(collector::branchIdOf);
            return rebind(after, declarator.getNameAsString(), branchId);
        }
        if (node instanceof AssignExpr assign
                && assign.getOperator() == AssignExpr.Operator.ASSIGN
                && assign.getTarget() instanceof NameExpr target) {
            TraversalState after = walkChildren(assign, state, collector);
            return rebind(after, target.getNameAsString(), collector.branchIdOf(assign.getValue()));
        }
        TraversalState after = walkChildren(node, state, collector);
        return node instanceof Expression || node instanceof ExpressionStmt ? after : state;
    }

    private TraversalState walkChildren(Node node, TraversalState state, Collector collector) {
        List<Node> children = new ArrayList<>(node.getChildNodes());
        children.sort(SOURCE_ORDER);
        TraversalState current = state;
        for (Node child : children) {
            current = walk(child, current, collector);
        }
        return current;
    }

    private void walkConditional(Expression condition, Node thenArm, Node elseArm,
                                 TraversalState state, Collector collector) {
        TraversalState afterCondition = walk(condition, state, collector);
        Optional<Guard> guard = resolveGuard(condition, afterCondition, collector, false);
        if (guard.isPresent()) {
            Guard g = guard.get();
            collector.markGuarded(g.branchId());
            walk(thenArm, afterCondition.enterArm(g.branchId(), !g.negated()), collector);
            if (elseArm != null) {
                walk(elseArm, afterCondition.enterArm(g.branchId(), g.negated()), collector);
            }
            return;
        }
        walk(thenArm, afterCondition, collector);
        if (elseArm != null) {
            walk(elseArm, afterCondition, collector);
        }
    }

    private Optional<Guard> resolveGuard(Expression condition, TraversalState state,
                                         Collector collector, boolean negated) {
        Expression e = MarkerArguments.unwrap(condition);
        if (e instanceof UnaryExpr unary && unary.getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT) {
            return resolveGuard(unary.getExpression(), state, collector, !negated);
        }
        if (e instanceof MethodCallExpr) {
            return collector.branchIdOf(e).map(id -> new Guard(id, negated));
        }
        if (e instanceof NameExpr name) {
            return state.branchBoundTo(name.getNameAsString()).map(id -> new Guard(id, negated));
        }
        return Optional.empty();
    }

    private static TraversalState rebind(TraversalState state, String variable, Optional<String> branchId) {
        return branchId.map(id -> state.bind(variable, id)).orElseGet(() -> state.unbind(variable));
    }

    private static int nameLine(NodeWithSimpleName<?> node) {
        return lineOf(node.getName());
    }

    static int lineOf(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }

    private record Guard(String branchId, boolean negated) {}

    // ── Collector ────────────────────────────────────────────────────

    /** Mutable sink for one extraction. Never shared. */
    private static final class Collector {

        private final MarkerNames markers;
        private final String workflowName;
        private final List<ActivityCall> activities = new ArrayList<>();
        private final List<ChildWorkflowCall> childWorkflowCalls = new ArrayList<>();
        private final List<ExternalSignalCall> externalSignalCalls = new ArrayList<>();
        private final List<MarkerDiagnostic> diagnostics = new ArrayList<>();
        private final Map<String, BranchBuilder> branches = new LinkedHashMap<>();
        private final Map<MethodCallExpr, String> branchByCall = new IdentityHashMap<>();
        private int decisionCount;
        private int signalCount;

        Collector(MarkerNames markers, String workflowName) {
            this.markers = markers;
            this.workflowName = workflowName;
        }

        void record(MethodCallExpr call, TraversalState state) {
            String callee = call.getNameAsString();
            int line = lineOf(call);
            if (markers.activityCalls().contains(callee)) {
                String name = MarkerArguments.argument(call, 0)
                        .flatMap(MarkerArguments::activityName)
                        .orElseGet(() -> fallback(callee, line, "activityL" + line,
                                "activity name is not statically resolvable", call, 0));
                activities.add(new ActivityCall(name, line));
                scope(line, state);
                log.debug("[workflow-graph] marker.activity name={} line={} scoped={}", name, line, state.insideBranch());
            } else if (markers.childWorkflowCalls().contains(callee)) {
                String name = MarkerArguments.argument(call, 0)
                        .flatMap(MarkerArguments::childWorkflowName)
                        .orElseGet(() -> fallback(callee, line, "childWorkflowL" + line,
                                "child workflow name is not statically resolvable", call, 0));
                childWorkflowCalls.add(new ChildWorkflowCall(name, line));
                scope(line, state);
                log.debug("[workflow-graph] marker.child-workflow name={} line={}", name, line);
            } else if (markers.externalSignalCalls().contains(callee)) {
                String signal = MarkerArguments.argument(call, 1)
                        .flatMap(MarkerArguments::literal)
                        .filter(s -> !s.isBlank())
                        .orElseGet(() -> fallback(callee, line, "signalL" + line,
                                "signal name must be a string literal", call, 1));
                String target = MarkerArguments.targetPattern(MarkerArguments.argument(call, 0));
                externalSignalCalls.add(new ExternalSignalCall(signal, target, line));
                scope(line, state);
                log.debug("[workflow-graph] marker.external-signal signal={} target={} line={}", signal, target, line);
            } else if (markers.decisionCalls().contains(callee)) {
                int ordinal = decisionCount++;
                String name = branchName(call, callee, 1, state.methodName() + "Decision" + ordinal, line);
                register(call, new BranchBuilder("d" + ordinal, name, line, false, callee));
                log.debug("[workflow-graph] marker.decision id=d{} name={} line={}", ordinal, name, line);
            } else if (markers.signalCalls().contains(callee)) {
                int ordinal = signalCount++;
                String name = branchName(call, callee, 2, state.methodName() + "Signal" + ordinal, line);
                register(call, new BranchBuilder("sig" + ordinal, name, line, true, callee));
                log.debug("[workflow-graph] marker.signal id=sig{} name={} line={}", ordinal, name, line);
            }
        }

        Optional<String> branchIdOf(Expression expression) {
            Expression e = MarkerArguments.unwrap(expression);
            return e instanceof MethodCallExpr call
                    ? Optional.ofNullable(branchByCall.get(call))
                    : Optional.empty();
        }

        void markGuarded(String branchId) {
            branches.get(branchId).guarded = true;
        }

        void reportUnguardedBranches() {
            for (BranchBuilder branch : branches.values()) {
                if (!branch.guarded) {
                    diagnose(branch.marker, branch.line, "outcome of '" + branch.name
                            + "' does not guard any conditional; no step is restricted by it");
                }
            }
        }

        List<DecisionPoint> decisionPoints() {
            return branches.values().stream()
                    .filter(b -> !b.signal)
                    .map(b -> new DecisionPoint(b.id, b.name, b.line, b.trueLines, b.falseLines))
                    .toList();
        }

        List<SignalPoint> signalPoints() {
            return branches.values().stream()
                    .filter(b -> b.signal)
                    .map(b -> new SignalPoint(b.id, b.name, b.line, b.trueLines, b.falseLines))
                    .toList();
        }

        private void register(MethodCallExpr call, BranchBuilder branch) {
            branches.put(branch.id, branch);
            branchByCall.put(call, branch.id);
        }

        private void scope(int line, TraversalState state) {
            for (TraversalState.ArmScope arm : state.scopes()) {
                branches.get(arm.branchId()).linesFor(arm.outcome()).add(line);
            }
        }

        private String branchName(MethodCallExpr call, String callee, int index, String fallbackName, int line) {
            return MarkerArguments.argument(call, index)
                    .flatMap(MarkerArguments::literal)
                    .filter(s -> !s.isBlank())
                    .orElseGet(() -> fallback(callee, line, fallbackName,
                            "name argument must be a non-blank string literal", call, index));
        }

        private String fallback(String marker, int line, String fallbackName, String reason,
                                MethodCallExpr call, int index) {
            String found = MarkerArguments.argument(call, index)
                    .map(MarkerArguments::describe)
                    .orElse("no argument");
            diagnose(marker, line, reason + " (found " + found + "), using '" + fallbackName + "'");
            return fallbackName;
        }

        private void diagnose(String marker, int line, String message) {
            MarkerDiagnostic diagnostic = new MarkerDiagnostic(marker, line, message);
            diagnostics.add(diagnostic);
            log.warn("[workflow-graph] marker.diagnostic workflow={} {}", workflowName, diagnostic.format());
        }
    }

    private static final class BranchBuilder {
        private final String id;
        private final String name;
        private final int line;
        private final boolean signal;
        private final String marker;
        private final SortedSet<Integer> trueLines = new TreeSet<>();
        private final SortedSet<Integer> falseLines = new TreeSet<>();
        private boolean guarded;

        BranchBuilder(String id, String name, int line, boolean signal, String marker) {
            this.id = id;
            this.name = name;
            this.line = line;
            this.signal = signal;
            this.marker = marker;
        }

        SortedSet<Integer> linesFor(boolean outcome) {
            return outcome ? trueLines : falseLines;
        }
    }
}
