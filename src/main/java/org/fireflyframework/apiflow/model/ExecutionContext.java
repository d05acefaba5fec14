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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of what an execution has accumulated so far: input parameters,
 * execution attributes and the outputs of succeeded steps.
 * <p>
 * Values are addressed with dotted references:
 * <ul>
 *   <li>{@code step.<stepOrder>.<path>} output of the step with that order</li>
 *   <li>{@code param.<path>} execution input parameters</li>
 *   <li>{@code global.<name>} execution attributes (executionId, workflowId, userId, attempt)</li>
 * </ul>
 */
public record ExecutionContext(
        String executionId,
        String workflowId,
        String userId,
        Map<String, Object> parameters,
        Map<Integer, Object> stepOutputs,
        Map<Integer, StepResultStatus> stepStatuses,
        int attempt
) {

    public ExecutionContext {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        stepOutputs = stepOutputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stepOutputs));
        stepStatuses = stepStatuses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stepStatuses));
    }

    /**
     * Builds the context for the next attempt of an execution's current step.
     * For each step the latest attempt wins.
     */
    public static ExecutionContext from(WorkflowExecution execution) {
        Map<Integer, Object> outputs = new LinkedHashMap<>();
        Map<Integer, StepResultStatus> statuses = new LinkedHashMap<>();
        for (StepResult result : execution.stepResults()) {
            statuses.put(result.stepOrder(), result.status());
            if (result.status() == StepResultStatus.SUCCEEDED) {
                outputs.put(result.stepOrder(), result.output());
            } else {
                outputs.remove(result.stepOrder());
            }
        }
        return new ExecutionContext(
                execution.id(),
                execution.workflowId(),
                execution.userId(),
                execution.parameters(),
                outputs,
                statuses,
                execution.retryState().attemptCount() + 1);
    }

    /**
     * Gets the execution attributes exposed under {@code global.}.
     */
    public Map<String, Object> globals() {
        Map<String, Object> globals = new LinkedHashMap<>();
        globals.put("executionId", executionId);
        globals.put("workflowId", workflowId);
        globals.put("userId", userId);
        globals.put("attempt", attempt);
        return globals;
    }

    /**
     * Resolves a dotted reference.
     *
     * @param reference e.g. {@code step.1.data.id}
     * @return the value, or null when any segment is missing
     */
    public Object lookup(String reference) {
        if (reference == null || reference.isBlank()) {
            return null;
        }
        String[] parts = reference.trim().split("\\.");
        return switch (parts[0]) {
            case "step" -> {
                if (parts.length < 2) {
                    yield null;
                }
                Integer order = parseIndex(parts[1]);
                yield order == null ? null : navigate(stepOutputs.get(order), parts, 2);
            }
            case "param" -> navigate(parameters, parts, 1);
            case "global" -> navigate(globals(), parts, 1);
            default -> null;
        };
    }

    private static Object navigate(Object root, String[] parts, int from) {
        Object current = root;
        for (int i = from; i < parts.length && current != null; i++) {
            String key = parts[i];
            if (current instanceof Map<?, ?> map) {
                current = map.get(key);
            } else if (current instanceof List<?> list) {
                Integer index = parseIndex(key);
                current = index != null && index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
        }
        return current;
    }

    private static Integer parseIndex(String value) {
        try {
            int index = Integer.parseInt(value);
            return index >= 0 ? index : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
