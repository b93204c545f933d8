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

import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import org.fireflyframework.workflowgraph.core.model.ExternalSignalCall;
import org.fireflyframework.workflowgraph.core.options.MarkerNames;

import java.util.Optional;

/**
 * Reads names out of marker call arguments. Every method returns empty when the argument
 * shape is not statically resolvable; callers fall back to a derived name.
 */
final class MarkerArguments {

    static final String WILDCARD = "{*}";

    private MarkerArguments() {}

    static Optional<Expression> argument(MethodCallExpr call, int index) {
        return index < call.getArguments().size()
                ? Optional.of(unwrap(call.getArgument(index)))
                : Optional.empty();
    }

    /** String or text block literal value. */
    static Optional<String> literal(Expression expression) {
        Expression e = unwrap(expression);
        if (e instanceof StringLiteralExpr literal) {
            return Optional.of(literal.asString());
        }
        if (e instanceof TextBlockLiteralExpr textBlock) {
            return Optional.of(textBlock.asString().strip());
        }
        return Optional.empty();
    }

    /**
     * Activity name from {@code "Name"}, {@code Activities::name}, {@code Activities.class}
     * or a plain identifier.
     */
    static Optional<String> activityName(Expression expression) {
        Expression e = unwrap(expression);
        if (e instanceof MethodReferenceExpr reference) {
            return Optional.of(reference.getIdentifier());
        }
        return typeOrLiteralName(e);
    }

    /**
     * Child workflow name from {@code "Name"}, {@code Workflow.class}, {@code Workflow::run}
     * or a plain identifier. For method references the type is the workflow.
     */
    static Optional<String> childWorkflowName(Expression expression) {
        Expression e = unwrap(expression);
        if (e instanceof MethodReferenceExpr reference) {
            return Optional.of(simpleTypeName(reference.getScope().toString()));
        }
        return typeOrLiteralName(e);
    }

    /**
     * Target workflow id of an external signal. Literal parts of a string concatenation are
     * kept and every other operand becomes {@value #WILDCARD}.
     */
    static String targetPattern(Optional<Expression> expression) {
        if (expression.isEmpty()) {
            return ExternalSignalCall.UNKNOWN_TARGET;
        }
        Expression e = unwrap(expression.get());
        Optional<String> literal = literal(e);
        if (literal.isPresent()) {
            return literal.get();
        }
        if (isConcatenation(e)) {
            StringBuilder pattern = new StringBuilder();
            appendPattern(e, pattern);
            return pattern.toString();
        }
        return ExternalSignalCall.DYNAMIC_TARGET;
    }

    static Expression unwrap(Expression expression) {
        Expression e = expression;
        while (e instanceof EnclosedExpr enclosed) {
            e = enclosed.getInner();
        }
        return e;
    }

    static String describe(Expression expression) {
        return unwrap(expression).getClass().getSimpleName();
    }

    private static Optional<String> typeOrLiteralName(Expression e) {
        Optional<String> literal = literal(e);
        if (literal.isPresent()) {
            return literal.filter(s -> !s.isBlank());
        }
        if (e instanceof ClassExpr classExpr) {
            return Optional.of(simpleTypeName(classExpr.getType().asString()));
        }
        if (e instanceof NameExpr name) {
            return Optional.of(name.getNameAsString());
        }
        if (e instanceof FieldAccessExpr field) {
            return Optional.of(field.getNameAsString());
        }
        return Optional.empty();
    }

    private static boolean isConcatenation(Expression e) {
        return e instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.PLUS;
    }

    private static void appendPattern(Expression expression, StringBuilder pattern) {
        Expression e = unwrap(expression);
        if (e instanceof BinaryExpr binary && binary.getOperator() == BinaryExpr.Operator.PLUS) {
            appendPattern(binary.getLeft(), pattern);
            appendPattern(binary.getRight(), pattern);
            return;
        }
        literal(e).ifPresentOrElse(pattern::append, () -> pattern.append(WILDCARD));
    }

    private static String simpleTypeName(String type) {
        String raw = type;
        int generic = raw.indexOf('<');
        if (generic >= 0) {
            raw = raw.substring(0, generic);
        }
        return MarkerNames.simpleName(raw.trim());
    }
}
