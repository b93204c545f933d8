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

/**
 * One step of an execution path. The set of step kinds is closed; code that needs to
 * treat kinds differently switches over {@link #kind()} without a default branch.
 */
public sealed interface PathStep permits
        PathStep.ActivityStep, PathStep.DecisionOutcomeStep, PathStep.SignalOutcomeStep,
        PathStep.ChildWorkflowStep, PathStep.ExternalSignalStep {

    StepKind kind();

    String name();

    int sourceLine();

    record ActivityStep(String name, int sourceLine) implements PathStep {
        @Override
        public StepKind kind() {
            return StepKind.ACTIVITY;
        }
    }

    record DecisionOutcomeStep(String branchId, String name, int sourceLine, boolean outcome) implements PathStep {
        @Override
        public StepKind kind() {
            return StepKind.DECISION;
        }
    }

    record SignalOutcomeStep(String branchId, String name, int sourceLine, boolean outcome) implements PathStep {
        @Override
        public StepKind kind() {
            return StepKind.SIGNAL;
        }
    }

    record ChildWorkflowStep(String name, int sourceLine) implements PathStep {
        @Override
        public StepKind kind() {
            return StepKind.CHILD_WORKFLOW;
        }
    }

    record ExternalSignalStep(String name, String targetPattern, int sourceLine) implements PathStep {
        @Override
        public StepKind kind() {
            return StepKind.EXTERNAL_SIGNAL;
        }
    }
}
