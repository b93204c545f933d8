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

package org.fireflyframework.workflowgraph.core.model;

import java.util.Objects;

/**
 * A signal sent from the workflow to another running workflow.
 *
 * @param signalName    name of the signal being sent, used as the step name
 * @param targetPattern workflow id of the receiver as far as it is statically known;
 *                      non-literal parts are replaced by {@code {*}}, {@code <dynamic>}
 *                      when nothing is known and {@code <unknown>} when no target was given
 * @param sourceLine    line of the call
 */
public record ExternalSignalCall(String signalName, String targetPattern, int sourceLine) implements WorkflowCall {

    public static final String DYNAMIC_TARGET = "<dynamic>";
    public static final String UNKNOWN_TARGET = "<unknown>";

    public ExternalSignalCall {
        Objects.requireNonNull(signalName, "signalName");
        targetPattern = targetPattern != null ? targetPattern : UNKNOWN_TARGET;
    }

    @Override
    public PathStep toStep() {
        return new PathStep.ExternalSignalStep(signalName, targetPattern, sourceLine);
    }
}
