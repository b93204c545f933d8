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

package org.fireflyframework.workflowgraph.core.render;

/**
 * A directed connection between two diagram nodes. {@code label} is {@code null} for
 * unlabeled edges; {@code signal} selects the dotted style used for edges into or out of an
 * external signal node.
 */
public record DiagramEdge(String from, String to, String label, boolean signal) {

    public String toMermaid() {
        String arrow = signal ? "-.signal.->" : "-->";
        return label == null
                ? from + " " + arrow + " " + to
                : from + " -- " + label + " " + arrow + " " + to;
    }
}
