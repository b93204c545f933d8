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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Label and id helpers shared by the diagram and the path list.
 */
public final class DisplayNames {

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern NON_ID_CHARACTER = Pattern.compile("[^a-zA-Z0-9_]");
    private static final Pattern PLAIN_TEXT = Pattern.compile("[a-zA-Z0-9_ '.,:-]*");

    private DisplayNames() {}

    /** {@code WithdrawFunds} becomes {@code Withdraw Funds}; never applied to node ids. */
    public static String split(String name) {
        return CAMEL_BOUNDARY.matcher(name).replaceAll("$1 $2");
    }

    public static String label(String name, boolean splitNames) {
        return splitNames ? split(name) : name;
    }

    /**
     * Node text as Mermaid accepts it inside any shape: plain text stays bare, anything else
     * is quoted with quotes and angle brackets written as entity codes.
     */
    public static String nodeText(String text) {
        if (PLAIN_TEXT.matcher(text).matches()) {
            return text;
        }
        return "\"" + text.replace("\"", "#quot;").replace("<", "#lt;").replace(">", "#gt;") + "\"";
    }

    public static String sanitizeId(String id) {
        return NON_ID_CHARACTER.matcher(id).replaceAll("_");
    }

    public static String lowerCaseId(String id) {
        return sanitizeId(id.toLowerCase(Locale.ROOT));
    }
}
