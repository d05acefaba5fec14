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

package org.fireflyframework.apiflow.runner;

import org.fireflyframework.apiflow.model.StepError;

import java.util.Objects;

/**
 * What a {@link StepRunner} reports for one attempt.
 */
public interface StepOutcome {

    boolean succeeded();

    /**
     * The call succeeded.
     *
     * @param output the response body
     * @param statusCode the HTTP status, if any
     */
    record Succeeded(Object output, Integer statusCode) implements StepOutcome {
        @Override
        public boolean succeeded() {
            return true;
        }
    }

    /**
     * The call failed; {@link StepError#retryable()} tells whether another attempt may help.
     */
    record Failed(StepError error) implements StepOutcome {

        public Failed {
            Objects.requireNonNull(error, "error cannot be null");
        }

        @Override
        public boolean succeeded() {
            return false;
        }
    }
}
