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
import java.util.SortedSet;

/**
 * A wait-for-signal marker: the workflow either receives the signal (true) or times out (false).
 */
public record SignalPoint(String id,
                          String displayName,
                          int sourceLine,
                          SortedSet<Integer> signaledBranchLines,
                          SortedSet<Integer> timeoutBranchLines) implements BranchPoint {

    public SignalPoint {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
        signaledBranchLines = DecisionPoint.copyOf(signaledBranchLines);
        timeoutBranchLines = DecisionPoint.copyOf(timeoutBranchLines);
    }

    public SignalPoint(String id, String displayName, int sourceLine) {
        this(id, displayName, sourceLine, null, null);
    }

    @Override
    public SortedSet<Integer> trueBranchLines() {
        return signaledBranchLines;
    }

    @Override
    public SortedSet<Integer> falseBranchLines() {
        return timeoutBranchLines;
    }

    @Override
    public BranchKind kind() {
        return BranchKind.SIGNAL;
    }
}
