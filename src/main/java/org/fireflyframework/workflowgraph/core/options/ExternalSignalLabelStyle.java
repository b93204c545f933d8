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
 * How external signal nodes are labeled: the signal name alone, or the signal name and
 * the target workflow id pattern ({@code Signal 'Ready' to order-{*}}).
 */
public enum ExternalSignalLabelStyle {
    NAME_ONLY,
    TARGET_PATTERN;

    /**
     * Parses {@code name-only} or {@code target-pattern}, ignoring case.
     *
     * @throws InvalidConfigurationException for any other value
     */
    public static ExternalSignalLabelStyle parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("external-signal-label-style", "must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ExternalSignalLabelStyle style : values()) {
            if (style.name().equals(normalized)) {
                return style;
            }
        }
        throw new InvalidConfigurationException("external-signal-label-style",
                "unrecognized value '" + value + "', expected one of "
                        + Arrays.stream(values())
                        .map(s -> s.name().toLowerCase(Locale.ROOT).replace('_', '-'))
                        .collect(Collectors.joining(", ")));
    }
}
