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

package org.fireflyframework.workflowgraph.marker;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Pass-through helpers that name a branch for the graph without changing behavior.
 *
 * <pre>{@code
 * if (toDecision(amount > 10_000, "HighValue")) {
 *     executeActivity("ManagerApproval");
 * }
 * if (waitCondition(() -> approved, Duration.ofHours(24), "Approval")) {
 *     executeActivity("Ship");
 * } else {
 *     executeActivity("Cancel");
 * }
 * }</pre>
 */
public final class WorkflowMarkers {

    private WorkflowMarkers() {}

    /** Returns {@code condition}; {@code name} labels the decision node. */
    public static boolean toDecision(boolean condition, String name) {
        return condition;
    }

    /**
     * Evaluates {@code condition} once and returns its value. Workflow runtimes that block
     * until the condition holds or {@code timeout} elapses bind their own implementation
     * under the same name; this one never waits.
     */
    public static boolean waitCondition(BooleanSupplier condition, Duration timeout, String name) {
        Objects.requireNonNull(condition, "condition");
        return condition.getAsBoolean();
    }
}
