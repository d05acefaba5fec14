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

import org.fireflyframework.apiflow.model.RetryState;
import org.fireflyframework.apiflow.model.StepError;
import org.fireflyframework.apiflow.model.StepRetryConfig;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a failed step is retried and when.
 * <p>
 * A step is retried only while {@code attemptCount < maxAttempts} and the error is
 * retryable. Non-retryable errors exhaust immediately. The delay grows as
 * {@code base * multiplier^(attemptCount - 1)}, is capped at the maximum delay and
 * shifted by a random jitter of up to {@code jitterFactor} in either direction.
 */
public class RetryBackoffPolicy {

    private final BackoffSettings settings;
    private final DoubleSupplier random;

    public RetryBackoffPolicy(BackoffSettings settings) {
        this(settings, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param settings backoff parameters
     * @param random source of values in [0, 1) used for jitter
     */
    public RetryBackoffPolicy(BackoffSettings settings, DoubleSupplier random) {
        this.settings = settings;
        this.random = random;
    }

    /**
     * Decides the fate of a failed attempt.
     *
     * @param state retry state after counting the failed attempt, with the effective max attempts
     * @param error the classified step error
     * @param override optional per-step backoff override
     * @param now the decision time
     * @return {@link RetryDecision.Retry} or {@link RetryDecision.Exhausted}
     */
    public RetryDecision decide(RetryState state, StepError error, StepRetryConfig override, Instant now) {
        if (!error.retryable()) {
            return new RetryDecision.Exhausted("non-retryable " + error.type() + ": " + error.message());
        }
        if (!state.hasAttemptsLeft()) {
            return new RetryDecision.Exhausted("attempts exhausted (" + state.attemptCount() + "/"
                    + state.maxAttempts() + ")");
        }

        Duration delay = jittered(settings.overriddenBy(override), state.attemptCount());
        return new RetryDecision.Retry(now.plus(delay), delay);
    }

    public RetryDecision decide(RetryState state, StepError error, Instant now) {
        return decide(state, error, null, now);
    }

    public BackoffSettings getSettings() {
        return settings;
    }

    private Duration jittered(BackoffSettings effective, int attemptCount) {
        long baseMs = effective.getDelayForAttempt(attemptCount).toMillis();
        double offset = (random.getAsDouble() * 2.0 - 1.0) * effective.jitterFactor() * baseMs;
        long delayMs = Math.round(baseMs + offset);
        delayMs = Math.min(delayMs, effective.maxDelay().toMillis());
        // retryAfter must lie strictly in the future
        return Duration.ofMillis(Math.max(1L, delayMs));
    }
}
