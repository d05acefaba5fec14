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

package org.fireflyframework.apiflow.model;

import java.util.List;

/**
 * Steps of an execution, captured when the execution first starts running.
 * Later edits to the workflow do not affect an execution that already has a plan.
 */
public record ExecutionPlan(List<WorkflowStep> steps) {

    public ExecutionPlan {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }

    public WorkflowStep step(int index) {
        if (index < 0 || index >= steps.size()) {
            throw new IllegalStateException("Step index " + index + " outside plan of " + steps.size() + " steps");
        }
        return steps.get(index);
    }
}
