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

import java.util.SortedSet;

/**
 * A location where execution forks into exactly two labelled continuations.
 *
 * <p>The two line sets hold the source lines of the calls lexically nested in each arm
 * of the conditional the branch point guards. A call is scoped by a branch point when
 * its line is in either set; scoped calls only run on paths that chose the matching
 * outcome, calls outside every scope run on all paths.
 */
public interface BranchPoint {

    String id();

    String displayName();

    int sourceLine();

    SortedSet<Integer> trueBranchLines();

    SortedSet<Integer> falseBranchLines();

    BranchKind kind();

    default SortedSet<Integer> linesFor(boolean outcome) {
        return outcome ? trueBranchLines() : falseBranchLines();
    }

    default boolean scopes(int line) {
        return trueBranchLines().contains(line) || falseBranchLines().contains(line);
    }

    /** {@code true} when no call was found in either arm. */
    default boolean isUnscoped() {
        return trueBranchLines().isEmpty() && falseBranchLines().isEmpty();
    }
}
