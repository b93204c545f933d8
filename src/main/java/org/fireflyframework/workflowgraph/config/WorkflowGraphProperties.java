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

package org.fireflyframework.workflowgraph.config;

import org.fireflyframework.workflowgraph.core.options.GraphOptions;
import org.fireflyframework.workflowgraph.core.options.MarkerNames;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for workflow graph generation.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   workflow-graph:
 *     enabled: true
 *     explosion-ceiling: 1024
 *     max-branch-points: 10
 *     split-display-names: true
 *     include-path-list: true
 *     output-mode: both
 *     external-signal-label-style: name-only
 *     labels:
 *       true-label: "yes"
 *       false-label: "no"
 *       signaled: Signaled
 *       timeout: Timeout
 *       start: Start
 *       end: End
 *     validation:
 *       suppress: false
 *       include-report: true
 *     metrics:
 *       enabled: true
 *     markers:
 *       workflow-type: Workflow
 *       entry-method: WorkflowMethod
 *       signal-handler: SignalMethod
 *       activity-calls: [executeActivity, executeLocalActivity]
 *       child-workflow-calls: [executeChildWorkflow]
 *       external-signal-calls: [signalExternalWorkflow]
 *       decision-calls: [toDecision]
 *       signal-calls: [waitCondition]
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.workflow-graph")
public class WorkflowGraphProperties {

    private boolean enabled = true;
    private int explosionCeiling = GraphOptions.DEFAULT_EXPLOSION_CEILING;
    private int maxBranchPoints = GraphOptions.DEFAULT_MAX_BRANCH_POINTS;
    private boolean splitDisplayNames = true;
    private boolean includePathList = true;
    private String outputMode = "both";
    private String externalSignalLabelStyle = "name-only";

    @NestedConfigurationProperty
    private LabelProperties labels = new LabelProperties();

    @NestedConfigurationProperty
    private ValidationProperties validation = new ValidationProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private MarkerProperties markers = new MarkerProperties();

    /** Validated options; invalid values fail with {@code InvalidConfigurationException}. */
    public GraphOptions toOptions() {
        return GraphOptions.builder()
                .explosionCeiling(explosionCeiling)
                .maxBranchPoints(maxBranchPoints)
                .splitDisplayNames(splitDisplayNames)
                .includePathList(includePathList)
                .outputMode(outputMode)
                .externalSignalLabelStyle(externalSignalLabelStyle)
                .trueLabel(labels.getTrueLabel())
                .falseLabel(labels.getFalseLabel())
                .signaledLabel(labels.getSignaled())
                .timeoutLabel(labels.getTimeout())
                .startLabel(labels.getStart())
                .endLabel(labels.getEnd())
                .suppressValidation(validation.isSuppress())
                .includeValidationReport(validation.isIncludeReport())
                .markers(markers.toMarkerNames())
                .build();
    }

    // --- Getters and Setters ---

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getExplosionCeiling() { return explosionCeiling; }
    public void setExplosionCeiling(int explosionCeiling) { this.explosionCeiling = explosionCeiling; }

    public int getMaxBranchPoints() { return maxBranchPoints; }
    public void setMaxBranchPoints(int maxBranchPoints) { this.maxBranchPoints = maxBranchPoints; }

    public boolean isSplitDisplayNames() { return splitDisplayNames; }
    public void setSplitDisplayNames(boolean splitDisplayNames) { this.splitDisplayNames = splitDisplayNames; }

    public boolean isIncludePathList() { return includePathList; }
    public void setIncludePathList(boolean includePathList) { this.includePathList = includePathList; }

    public String getOutputMode() { return outputMode; }
    public void setOutputMode(String outputMode) { this.outputMode = outputMode; }

    public String getExternalSignalLabelStyle() { return externalSignalLabelStyle; }
    public void setExternalSignalLabelStyle(String externalSignalLabelStyle) { this.externalSignalLabelStyle = externalSignalLabelStyle; }

    public LabelProperties getLabels() { return labels; }
    public void setLabels(LabelProperties labels) { this.labels = labels; }

    public ValidationProperties getValidation() { return validation; }
    public void setValidation(ValidationProperties validation) { this.validation = validation; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public MarkerProperties getMarkers() { return markers; }
    public void setMarkers(MarkerProperties markers) { this.markers = markers; }

    // --- Nested property classes ---

    public static class LabelProperties {
        private String trueLabel = "yes";
        private String falseLabel = "no";
        private String signaled = "Signaled";
        private String timeout = "Timeout";
        private String start = "Start";
        private String end = "End";

        public String getTrueLabel() { return trueLabel; }
        public void setTrueLabel(String trueLabel) { this.trueLabel = trueLabel; }

        public String getFalseLabel() { return falseLabel; }
        public void setFalseLabel(String falseLabel) { this.falseLabel = falseLabel; }

        public String getSignaled() { return signaled; }
        public void setSignaled(String signaled) { this.signaled = signaled; }

        public String getTimeout() { return timeout; }
        public void setTimeout(String timeout) { this.timeout = timeout; }

        public String getStart() { return start; }
        public void setStart(String start) { this.start = start; }

        public String getEnd() { return end; }
        public void setEnd(String end) { this.end = end; }
    }

    public static class ValidationProperties {
        private boolean suppress = false;
        private boolean includeReport = true;

        public boolean isSuppress() { return suppress; }
        public void setSuppress(boolean suppress) { this.suppress = suppress; }

        public boolean isIncludeReport() { return includeReport; }
        public void setIncludeReport(boolean includeReport) { this.includeReport = includeReport; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class MarkerProperties {
        private String workflowType = MarkerNames.DEFAULT.workflowType();
        private String entryMethod = MarkerNames.DEFAULT.entryMethod();
        private String signalHandler = MarkerNames.DEFAULT.signalHandler();
        private List<String> activityCalls = new ArrayList<>(MarkerNames.DEFAULT.activityCalls());
        private List<String> childWorkflowCalls = new ArrayList<>(MarkerNames.DEFAULT.childWorkflowCalls());
        private List<String> externalSignalCalls = new ArrayList<>(MarkerNames.DEFAULT.externalSignalCalls());
        private List<String> decisionCalls = new ArrayList<>(MarkerNames.DEFAULT.decisionCalls());
        private List<String> signalCalls = new ArrayList<>(MarkerNames.DEFAULT.signalCalls());

        MarkerNames toMarkerNames() {
            return new MarkerNames(workflowType, entryMethod, signalHandler, activityCalls,
                    childWorkflowCalls, externalSignalCalls, decisionCalls, signalCalls);
        }

        public String getWorkflowType() { return workflowType; }
        public void setWorkflowType(String workflowType) { this.workflowType = workflowType; }

        public String getEntryMethod() { return entryMethod; }
        public void setEntryMethod(String entryMethod) { this.entryMethod = entryMethod; }

        public String getSignalHandler() { return signalHandler; }
        public void setSignalHandler(String signalHandler) { this.signalHandler = signalHandler; }

        public List<String> getActivityCalls() { return activityCalls; }
        public void setActivityCalls(List<String> activityCalls) { this.activityCalls = activityCalls; }

        public List<String> getChildWorkflowCalls() { return childWorkflowCalls; }
        public void setChildWorkflowCalls(List<String> childWorkflowCalls) { this.childWorkflowCalls = childWorkflowCalls; }

        public List<String> getExternalSignalCalls() { return externalSignalCalls; }
        public void setExternalSignalCalls(List<String> externalSignalCalls) { this.externalSignalCalls = externalSignalCalls; }

        public List<String> getDecisionCalls() { return decisionCalls; }
        public void setDecisionCalls(List<String> decisionCalls) { this.decisionCalls = decisionCalls; }

        public List<String> getSignalCalls() { return signalCalls; }
        public void setSignalCalls(List<String> signalCalls) { this.signalCalls = signalCalls; }
    }
}
