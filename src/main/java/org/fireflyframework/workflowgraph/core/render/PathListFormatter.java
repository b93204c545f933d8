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

import org.fireflyframework.workflowgraph.core.model.PathStep;
import org.fireflyframework.workflowgraph.core.options.GraphOptions;
import org.fireflyframework.workflowgraph.core.path.ExecutionPath;

import java.util.ArrayList;
import java.util.List;

/**
 * Textual companion of the diagram: one numbered line per path listing its plain steps.
 */
public class PathListFormatter {

    static final String ARROW = " → ";

    public String format(List<ExecutionPath> paths) {
        return format(paths, GraphOptions.defaults());
    }

    public String format(List<ExecutionPath> paths, GraphOptions options) {
        List<String> lines = new ArrayList<>(paths.size() + 3);
        lines.add("--- Execution Paths (" + paths.size() + " total) ---");
        int branchCount = paths.isEmpty() ? 0 : paths.get(0).outcomes().size();
        if (branchCount > 0) {
            lines.add("Branch Points: " + branchCount + " (2^" + branchCount + " = " + paths.size() + " paths)");
        }
        lines.add("");
        for (int i = 0; i < paths.size(); i++) {
            lines.add("Path " + (i + 1) + ": " + describe(paths.get(i), options));
        }
        return String.join("\n", lines);
    }

    private static String describe(ExecutionPath path, GraphOptions options) {
        List<String> names = new ArrayList<>();
        names.add(options.startLabel());
        for (PathStep step : path.plainSteps()) {
            names.add(DisplayNames.label(step.name(), options.splitDisplayNames()));
        }
        names.add(options.endLabel());
        return String.join(ARROW, names);
    }
}
