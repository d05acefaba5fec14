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

import java.time.Duration;
import java.time.Instant;

/**
 * Result of {@link RetryBackoffPolicy#decide}: either retry at a given time or give up.
 */
public interface RetryDecision {

    /**
     * Whether another attempt should be scheduled.
     */
    boolean shouldRetry();

    /**
     * Retry the current step no earlier than {@code after}.
     *
     * @param after the earliest redelivery time, strictly after the decision time
     * @param delay the jittered delay that produced {@code after}
     */
    record Retry(Instant after, Duration delay) implements RetryDecision {
        @Override
        public boolean shouldRetry() {
            return true;
        }
    }

    /**
     * Stop retrying; the execution fails.
     *
     * @param reason why no retry is made
     */
    record Exhausted(String reason) implements RetryDecision {
        @Override
        public boolean shouldRetry() {
            return false;
        }
    }
}
