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

package org.fireflyframework.workflowgraph.core.exception;

import java.util.Map;

/**
 * Base type for every fatal error raised by the workflow graph pipeline.
 *
 * <p>Carries a stable error code and a context map so callers can act on the failure
 * without consulting logs.
 */
public abstract class WorkflowGraphException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> context;

    protected WorkflowGraphException(String message, String errorCode, Map<String, Object> context) {
        this(message, errorCode, context, null);
    }

    protected WorkflowGraphException(String message, String errorCode, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
