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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable context of one point in the walk over a workflow method body.
 *
 * <p>{@code scopes} lists the conditional arms enclosing the current node, outermost first.
 * {@code bindings} maps local variable names to the branch point whose result they hold,
 * so that {@code boolean approved = toDecision(...); if (approved) ...} is recognised.
 * Every transition returns a new state; callers thread the returned state through
 * sequential statements and drop it when leaving a block.
 */
record TraversalState(String methodName, List<ArmScope> scopes, Map<String, String> bindings) {

    /** One enclosing arm: the branch point and the outcome that leads into the arm. */
    record ArmScope(String branchId, boolean outcome) {}

    TraversalState {
        scopes = List.copyOf(scopes);
        bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    static TraversalState root(String methodName) {
        return new TraversalState(methodName, List.of(), Map.of());
    }

    TraversalState enterArm(String branchId, boolean outcome) {
        List<ArmScope> next = new ArrayList<>(scopes.size() + 1);
        next.addAll(scopes);
        next.add(new ArmScope(branchId, outcome));
        return new TraversalState(methodName, next, bindings);
    }

    TraversalState bind(String variable, String branchId) {
        Map<String, String> next = new LinkedHashMap<>(bindings);
        next.put(variable, branchId);
        return new TraversalState(methodName, scopes, next);
    }

    TraversalState unbind(String variable) {
        if (!bindings.containsKey(variable)) {
            return this;
        }
        Map<String, String> next = new LinkedHashMap<>(bindings);
        next.remove(variable);
        return new TraversalState(methodName, scopes, next);
    }

    Optional<String> branchBoundTo(String variable) {
        return Optional.ofNullable(bindings.get(variable));
    }

    boolean insideBranch() {
        return !scopes.isEmpty();
    }
}
