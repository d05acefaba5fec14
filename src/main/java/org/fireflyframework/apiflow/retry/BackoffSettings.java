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

package org.fireflyframework.apiflow.retry;

import org.fireflyframework.apiflow.model.StepRetryConfig;

import java.time.Duration;

/**
 * Exponential backoff parameters.
 *
 * @param baseDelay delay before the first retry
 * @param maxDelay upper bound for any delay, jitter included
 * @param multiplier growth factor between consecutive retries
 * @param jitterFactor maximum relative jitter applied in both directions, 0 to 1
 */
public record BackoffSettings(
        Duration baseDelay,
        Duration maxDelay,
        double multiplier,
        double jitterFactor
) {

    /**
     * 5 seconds doubling up to 5 minutes with 20% jitter.
     */
    public static final BackoffSettings DEFAULT = new BackoffSettings(
            Duration.ofSeconds(5),
            Duration.ofMinutes(5),
            2.0,
            0.2
    );

    public BackoffSettings {
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be zero or positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
        }
    }

    /**
     * Applies a step's overrides on top of these settings.
     */
    public BackoffSettings overriddenBy(StepRetryConfig override) {
        if (override == null) {
            return this;
        }
        Duration base = override.baseDelay() != null ? override.baseDelay() : baseDelay;
        Duration max = override.maxDelay() != null ? override.maxDelay() : maxDelay;
        return new BackoffSettings(base, max.compareTo(base) < 0 ? base : max, multiplier, jitterFactor);
    }

    /**
     * Calculates the delay before the next attempt, without jitter.
     *
     * @param failedAttempts failed attempts of the step so far (1-based)
     * @return the capped delay
     */
    public Duration getDelayForAttempt(int failedAttempts) {
        int exponent = Math.max(0, failedAttempts - 1);
        double delayMs = baseDelay.toMillis() * Math.pow(multiplier, exponent);
        long capped = (long) Math.min(delayMs, (double) maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }
}
