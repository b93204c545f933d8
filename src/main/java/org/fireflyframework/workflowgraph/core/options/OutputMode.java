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

package org.fireflyframework.workflowgraph.core.options;

import org.fireflyframework.workflowgraph.core.exception.InvalidConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Which sections the rendered output contains.
 */
public enum OutputMode {
    DIAGRAM,
    PATH_LIST,
    BOTH;

    public boolean includesDiagram() {
        return this == DIAGRAM || this == BOTH;
    }

    public boolean includesPathList() {
        return this == PATH_LIST || this == BOTH;
    }

    /**
     * Parses {@code diagram}, {@code path-list} / {@code path_list} or {@code both}, ignoring case.
     *
     * @throws InvalidConfigurationException for any other value
     */
    public static OutputMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("output-mode", "must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (OutputMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new InvalidConfigurationException("output-mode",
                "unrecognized value '" + value + "', expected one of "
                        + Arrays.stream(values())
                        .map(m -> m.name().toLowerCase(Locale.ROOT).replace('_', '-'))
                        .collect(Collectors.joining(", ")));
    }
}
