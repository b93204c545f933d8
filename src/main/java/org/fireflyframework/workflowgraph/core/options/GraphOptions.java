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

import java.util.Objects;

/**
 * Immutable configuration of one pipeline invocation. Validated eagerly: an invalid
 * value fails construction with {@link InvalidConfigurationException} before any
 * traversal starts.
 *
 * <p>{@code splitDisplayNames} defaults to {@code true}: labels read "Withdraw Funds"
 * for a step named {@code WithdrawFunds}. Node ids are never affected.
 */
public record GraphOptions(
        int explosionCeiling,
        String trueLabel,
        String falseLabel,
        String signaledLabel,
        String timeoutLabel,
        String startLabel,
        String endLabel,
        boolean splitDisplayNames,
        boolean includePathList,
        OutputMode outputMode,
        ExternalSignalLabelStyle externalSignalLabelStyle,
        int maxBranchPoints,
        boolean suppressValidation,
        boolean includeValidationReport,
        MarkerNames markers
) {

    public static final int DEFAULT_EXPLOSION_CEILING = 1024;
    public static final int DEFAULT_MAX_BRANCH_POINTS = 10;

    public GraphOptions {
        if (explosionCeiling < 1) {
            throw new InvalidConfigurationException("explosion-ceiling",
                    "must be a positive number of paths, got " + explosionCeiling);
        }
        if (maxBranchPoints < 0) {
            throw new InvalidConfigurationException("max-branch-points",
                    "must not be negative, got " + maxBranchPoints);
        }
        requireLabel("true-label", trueLabel);
        requireLabel("false-label", falseLabel);
        requireLabel("signaled-label", signaledLabel);
        requireLabel("timeout-label", timeoutLabel);
        requireLabel("start-label", startLabel);
        requireLabel("end-label", endLabel);
        if (outputMode == null) {
            throw new InvalidConfigurationException("output-mode", "must not be null");
        }
        if (externalSignalLabelStyle == null) {
            throw new InvalidConfigurationException("external-signal-label-style", "must not be null");
        }
        markers = Objects.requireNonNullElse(markers, MarkerNames.DEFAULT);
    }

    public static GraphOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .explosionCeiling(explosionCeiling)
                .trueLabel(trueLabel)
                .falseLabel(falseLabel)
                .signaledLabel(signaledLabel)
                .timeoutLabel(timeoutLabel)
                .startLabel(startLabel)
                .endLabel(endLabel)
                .splitDisplayNames(splitDisplayNames)
                .includePathList(includePathList)
                .outputMode(outputMode)
                .externalSignalLabelStyle(externalSignalLabelStyle)
                .maxBranchPoints(maxBranchPoints)
                .suppressValidation(suppressValidation)
                .includeValidationReport(includeValidationReport)
                .markers(markers);
    }

    /** Edge label for leaving a branch point of the given kind with the given outcome. */
    public String outcomeLabel(boolean signal, boolean outcome) {
        if (signal) {
            return outcome ? signaledLabel : timeoutLabel;
        }
        return outcome ? trueLabel : falseLabel;
    }

    private static void requireLabel(String option, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException(option, "must not be blank");
        }
    }

    public static final class Builder {
        private int explosionCeiling = DEFAULT_EXPLOSION_CEILING;
        private String trueLabel = "yes";
        private String falseLabel = "no";
        private String signaledLabel = "Signaled";
        private String timeoutLabel = "Timeout";
        private String startLabel = "Start";
        private String endLabel = "End";
        private boolean splitDisplayNames = true;
        private boolean includePathList = true;
        private OutputMode outputMode = OutputMode.BOTH;
        private ExternalSignalLabelStyle externalSignalLabelStyle = ExternalSignalLabelStyle.NAME_ONLY;
        private int maxBranchPoints = DEFAULT_MAX_BRANCH_POINTS;
        private boolean suppressValidation = false;
        private boolean includeValidationReport = true;
        private MarkerNames markers = MarkerNames.DEFAULT;

        private Builder() {}

        public Builder explosionCeiling(int explosionCeiling) { this.explosionCeiling = explosionCeiling; return this; }
        public Builder trueLabel(String trueLabel) { this.trueLabel = trueLabel; return this; }
        public Builder falseLabel(String falseLabel) { this.falseLabel = falseLabel; return this; }
        public Builder signaledLabel(String signaledLabel) { this.signaledLabel = signaledLabel; return this; }
        public Builder timeoutLabel(String timeoutLabel) { this.timeoutLabel = timeoutLabel; return this; }
        public Builder startLabel(String startLabel) { this.startLabel = startLabel; return this; }
        public Builder endLabel(String endLabel) { this.endLabel = endLabel; return this; }
        public Builder splitDisplayNames(boolean splitDisplayNames) { this.splitDisplayNames = splitDisplayNames; return this; }
        public Builder includePathList(boolean includePathList) { this.includePathList = includePathList; return this; }
        public Builder outputMode(OutputMode outputMode) { this.outputMode = outputMode; return this; }
        public Builder outputMode(String outputMode) { this.outputMode = OutputMode.parse(outputMode); return this; }
        public Builder externalSignalLabelStyle(ExternalSignalLabelStyle style) { this.externalSignalLabelStyle = style; return this; }
        public Builder externalSignalLabelStyle(String style) { this.externalSignalLabelStyle = ExternalSignalLabelStyle.parse(style); return this; }
        public Builder maxBranchPoints(int maxBranchPoints) { this.maxBranchPoints = maxBranchPoints; return this; }
        public Builder suppressValidation(boolean suppressValidation) { this.suppressValidation = suppressValidation; return this; }
        public Builder includeValidationReport(boolean includeValidationReport) { this.includeValidationReport = includeValidationReport; return this; }
        public Builder markers(MarkerNames markers) { this.markers = markers; return this; }

        public GraphOptions build() {
            return new GraphOptions(explosionCeiling, trueLabel, falseLabel, signaledLabel, timeoutLabel,
                    startLabel, endLabel, splitDisplayNames, includePathList, outputMode, externalSignalLabelStyle,
                    maxBranchPoints, suppressValidation, includeValidationReport, markers);
        }
    }
}
