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

/**
 * Progress snapshot derived from a {@link WorkflowExecution}.
 *
 * @param executionId the execution
 * @param status current status
 * @param currentStep index of the step in progress, null when not started or terminal
 * @param totalSteps steps in the plan
 * @param completedSteps steps that succeeded
 * @param failedSteps steps whose latest attempt failed
 * @param percentComplete completion percentage, 0 to 100
 * @param elapsedMs time since the execution started
 * @param estimatedRemainingMs linear estimate of the remaining time, null when unknown
 */
public record ExecutionProgress(
        String executionId,
        ExecutionStatus status,
        Integer currentStep,
        int totalSteps,
        int completedSteps,
        int failedSteps,
        int percentComplete,
        long elapsedMs,
        Long estimatedRemainingMs
) {
}
