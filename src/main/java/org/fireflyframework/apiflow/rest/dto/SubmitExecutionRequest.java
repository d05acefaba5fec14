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

package org.fireflyframework.apiflow.rest.dto;

import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request DTO for submitting a workflow execution.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitExecutionRequest {

    /**
     * The submitting user.
     */
    private String userId;

    /**
     * Input parameters, referenced from steps as {@code {{param.name}}}.
     */
    private Map<String, Object> parameters = new HashMap<>();

    /**
     * Attempts allowed per step. Falls back to {@code firefly.apiflow.retry.max-attempts}.
     */
    @Min(1)
    private Integer maxAttempts;
}
