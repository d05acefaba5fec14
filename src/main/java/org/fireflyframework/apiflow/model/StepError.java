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

import java.util.Objects;

/**
 * Error recorded on a FAILED {@link StepResult}.
 *
 * @param type the error classification
 * @param message human readable message
 * @param retryable whether another attempt may succeed
 * @param statusCode HTTP status of the remote response, if any
 */
public record StepError(
        StepErrorType type,
        String message,
        boolean retryable,
        Integer statusCode
) {

    public StepError {
        Objects.requireNonNull(type, "type cannot be null");
        if (message == null) {
            message = type.name();
        }
    }

    public static StepError retryable(StepErrorType type, String message) {
        return new StepError(type, message, true, null);
    }

    public static StepError nonRetryable(StepErrorType type, String message) {
        return new StepError(type, message, false, null);
    }

    /**
     * Creates a copy that is never retried.
     */
    public StepError asNonRetryable() {
        return new StepError(type, message, false, statusCode);
    }
}
