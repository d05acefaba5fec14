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

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered template of API steps.
 */
public record Workflow(
        String id,
        String userId,
        String name,
        String description,
        WorkflowStatus status,
        List<WorkflowStep> steps,
        Instant createdAt,
        Instant updatedAt
) {

    public Workflow {
        Objects.requireNonNull(id, "id cannot be null");
        if (status == null) {
            status = WorkflowStatus.DRAFT;
        }
        if (steps == null) {
            steps = List.of();
        }
        Set<Integer> orders = new HashSet<>();
        for (WorkflowStep step : steps) {
            if (!orders.add(step.stepOrder())) {
                throw new IllegalArgumentException(
                        "Duplicate stepOrder " + step.stepOrder() + " in workflow " + id);
            }
        }
        steps = steps.stream()
                .sorted(Comparator.comparingInt(WorkflowStep::stepOrder))
                .toList();
    }

    public boolean isActive() {
        return status == WorkflowStatus.ACTIVE;
    }

    /**
     * Snapshots the active steps in execution order.
     *
     * @return the immutable plan for a new execution
     */
    public ExecutionPlan toPlan() {
        return new ExecutionPlan(steps.stream()
                .filter(WorkflowStep::active)
                .toList());
    }
}
