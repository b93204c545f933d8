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

package org.fireflyframework.workflowgraph.unit.marker;

import org.fireflyframework.workflowgraph.marker.SignalMethod;
import org.fireflyframework.workflowgraph.marker.Workflow;
import org.fireflyframework.workflowgraph.marker.WorkflowMethod;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.fireflyframework.workflowgraph.marker.WorkflowMarkers.toDecision;
import static org.fireflyframework.workflowgraph.marker.WorkflowMarkers.waitCondition;

class WorkflowMarkersTest {

    @Workflow(name = "approval", description = "Approval flow")
    static class ApprovalWorkflow {

        private boolean approved;

        @WorkflowMethod
        public String run(long amount) {
            if (toDecision(amount > 10_000, "HighValue")) {
                return waitCondition(() -> approved, Duration.ofHours(24), "Approval") ? "approved" : "expired";
            }
            return "auto";
        }

        @SignalMethod("Approval")
        public void approve() {
            approved = true;
        }
    }

    @Test
    void markers_passValuesThroughUnchanged() {
        ApprovalWorkflow workflow = new ApprovalWorkflow();

        assertThat(workflow.run(5)).isEqualTo("auto");
        assertThat(workflow.run(20_000)).isEqualTo("expired");
        workflow.approve();
        assertThat(workflow.run(20_000)).isEqualTo("approved");
    }

    @Test
    void waitCondition_requiresCondition() {
        assertThatThrownBy(() -> waitCondition(null, Duration.ZERO, "x"))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void annotations_areRetainedAtRuntime() throws Exception {
        Workflow workflow = ApprovalWorkflow.class.getAnnotation(Workflow.class);

        assertThat(workflow.name()).isEqualTo("approval");
        assertThat(workflow.description()).isEqualTo("Approval flow");
        assertThat(ApprovalWorkflow.class.getMethod("run", long.class).isAnnotationPresent(WorkflowMethod.class)).isTrue();
        assertThat(ApprovalWorkflow.class.getMethod("approve").getAnnotation(SignalMethod.class).value())
                .isEqualTo("Approval");
    }
}
