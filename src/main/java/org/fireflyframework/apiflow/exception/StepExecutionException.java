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

package org.fireflyframework.apiflow.exception;

/**
 * Exception raised while executing a single step.
 * <p>
 * The step runner never lets these escape; they are classified into a
 * {@link org.fireflyframework.apiflow.model.StepError} and recorded on the execution.
 */
public abstract class StepExecutionException extends ApiFlowException {

    private final Integer statusCode;

    protected StepExecutionException(String message) {
        super(message);
        this.statusCode = null;
    }

    protected StepExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    protected StepExecutionException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    /**
     * Whether the step may be attempted again.
     */
    public abstract boolean isRetryable();
}
