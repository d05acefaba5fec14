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

import lombok.Builder;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only, user-facing log entry of an execution.
 *
 * @param id store-assigned sequence, null until persisted
 * @param executionId the execution
 * @param stepOrder the step the entry refers to, if any
 * @param stepName the step name, if any
 * @param level severity
 * @param message the message
 * @param data optional structured payload
 * @param timestamp when the entry was written
 */
@Builder
public record ExecutionLog(
        Long id,
        String executionId,
        Integer stepOrder,
        String stepName,
        LogLevel level,
        String message,
        Map<String, Object> data,
        Instant timestamp
) {

    public ExecutionLog {
        Objects.requireNonNull(executionId, "executionId cannot be null");
        Objects.requireNonNull(level, "level cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        if (data == null) {
            data = Map.of();
        }
    }

    public ExecutionLog withId(Long newId) {
        return new ExecutionLog(newId, executionId, stepOrder, stepName, level, message, data, timestamp);
    }

    public ExecutionLog withTimestamp(Instant newTimestamp) {
        return new ExecutionLog(id, executionId, stepOrder, stepName, level, message, data, newTimestamp);
    }
}
