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

import java.time.Duration;

/**
 * Per-step override of the engine's retry defaults. Null fields fall back to the defaults.
 *
 * @param maxAttempts total attempts allowed for the step, including the first
 * @param baseDelay delay before the first retry
 * @param maxDelay upper bound for the backoff delay
 */
public record StepRetryConfig(
        Integer maxAttempts,
        Duration baseDelay,
        Duration maxDelay
) {

    public StepRetryConfig {
        if (maxAttempts != null && maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static StepRetryConfig maxAttempts(int maxAttempts) {
        return new StepRetryConfig(maxAttempts, null, null);
    }
}
