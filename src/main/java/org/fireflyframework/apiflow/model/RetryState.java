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

/**
 * Retry bookkeeping of the step currently in progress.
 *
 * @param attemptCount failed attempts made for the current step
 * @param maxAttempts attempts allowed per step unless the step overrides it
 * @param retryAfter earliest time the execution may be picked up again, null when not retrying
 */
public record RetryState(
        int attemptCount,
        int maxAttempts,
        Instant retryAfter
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    public RetryState {
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount cannot be negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static RetryState initial(int maxAttempts) {
        return new RetryState(0, maxAttempts, null);
    }

    /**
     * Counts one more failed attempt of the current step.
     */
    public RetryState recordFailure() {
        return new RetryState(attemptCount + 1, maxAttempts, retryAfter);
    }

    public RetryState retryAt(Instant when) {
        return new RetryState(attemptCount, maxAttempts, when);
    }

    public RetryState withMaxAttempts(int max) {
        return new RetryState(attemptCount, max, retryAfter);
    }

    /**
     * Clears the delay but keeps the attempt count, used when a retry is picked up.
     */
    public RetryState clearRetryAfter() {
        return new RetryState(attemptCount, maxAttempts, null);
    }

    /**
     * Fresh state for the next step.
     */
    public RetryState reset() {
        return new RetryState(0, maxAttempts, null);
    }

    public boolean hasAttemptsLeft() {
        return attemptCount < maxAttempts;
    }

    public boolean isDue(Instant now) {
        return retryAfter == null || !now.isBefore(retryAfter);
    }
}
