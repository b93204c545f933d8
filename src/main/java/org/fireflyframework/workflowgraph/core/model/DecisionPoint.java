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

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

public record DecisionPoint(String id,
                            String displayName,
                            int sourceLine,
                            SortedSet<Integer> trueBranchLines,
                            SortedSet<Integer> falseBranchLines) implements BranchPoint {

    public DecisionPoint {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(displayName, "displayName");
        trueBranchLines = copyOf(trueBranchLines);
        falseBranchLines = copyOf(falseBranchLines);
    }

    public DecisionPoint(String id, String displayName, int sourceLine) {
        this(id, displayName, sourceLine, null, null);
    }

    @Override
    public BranchKind kind() {
        return BranchKind.DECISION;
    }

    static SortedSet<Integer> copyOf(Collection<Integer> lines) {
        return lines == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(lines));
    }
}
