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

package org.fireflyframework.apiflow;

import org.fireflyframework.apiflow.model.Workflow;
import org.fireflyframework.apiflow.model.WorkflowStatus;
import org.fireflyframework.apiflow.model.WorkflowStep;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Workflow fixtures shared by the tests.
 */
public final class TestWorkflows {

    public static final String WORKFLOW_ID = "wf-orders";
    public static final String CONNECTION = "crm";

    private TestWorkflows() {
    }

    public static WorkflowStep step(int order) {
        return WorkflowStep.of(order, "step-" + order, "GET /items/" + order, CONNECTION, Map.of());
    }

    public static Workflow active(WorkflowStep... steps) {
        return new Workflow(WORKFLOW_ID, "owner", "Orders", null, WorkflowStatus.ACTIVE,
                List.of(steps), Instant.parse("2026-01-01T00:00:00Z"), Instant.parse("2026-01-01T00:00:00Z"));
    }

    /**
     * An active workflow with steps ordered 1..count.
     */
    public static Workflow activeWithSteps(int count) {
        List<WorkflowStep> steps = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            steps.add(step(i));
        }
        return active(steps.toArray(new WorkflowStep[0]));
    }
}
