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

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.fireflyframework.apiflow.client.ApiResponse;
import org.fireflyframework.apiflow.condition.ConditionEvaluationException;
import org.fireflyframework.apiflow.exception.CredentialUnavailableException;
import org.fireflyframework.apiflow.exception.NonRetryableStepException;
import org.fireflyframework.apiflow.exception.RetryableStepException;
import org.fireflyframework.apiflow.exception.StepExecutionException;
import org.fireflyframework.apiflow.model.StepError;
import org.fireflyframework.apiflow.model.StepErrorType;
import org.fireflyframework.apiflow.model.WorkflowStep;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Maps step failures to {@link StepError}s.
 * <p>
 * Retryable: network errors, timeouts, 408, 429, 5xx and calls rejected by
 * resilience guards. Non-retryable: other 4xx, validation errors, unavailable
 * credentials and any error whose message carries a permanent error marker, matched
 * ignoring case. Markers never override a 408, 429 or 5xx status.
 */
public class StepErrorClassifier {

    private static final List<String> PERMANENT_MARKERS = List.of(
            "INVALID_API_KEY",
            "UNAUTHORIZED",
            "FORBIDDEN",
            "NOT_FOUND",
            "VALIDATION_ERROR",
            "INVALID_WORKFLOW",
            "USER_CANCELLED"
    );

    /**
     * Turns a non-2xx response into an exception carrying its classification.
     */
    public StepExecutionException toException(ApiResponse response) {
        int status = response.statusCode();
        String message = "HTTP " + status + describeBody(response.body());
        if (isRetryableStatus(status)) {
            return new RetryableStepException(status, message);
        }
        return new NonRetryableStepException(status, message);
    }

    public boolean isRetryableStatus(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    /**
     * Classifies an error raised while running a step.
     *
     * @param error the error
     * @param step the step, its idempotency decides whether timeouts are retried
     * @param timeout the enforced timeout, used in the message
     * @return the classified error
     */
    public StepError classify(Throwable error, WorkflowStep step, Duration timeout) {
        StepError classified = doClassify(error, step, timeout);
        boolean retryableStatus = classified.statusCode() != null && isRetryableStatus(classified.statusCode());
        if (classified.retryable() && !retryableStatus && hasPermanentMarker(classified.message())) {
            return classified.asNonRetryable();
        }
        return classified;
    }

    private StepError doClassify(Throwable error, WorkflowStep step, Duration timeout) {
        if (error instanceof TimeoutException) {
            String message = "Step timed out after " + timeout.toMillis() + "ms";
            return new StepError(StepErrorType.TIMEOUT, message, !step.nonIdempotent(), null);
        }
        if (error instanceof CredentialUnavailableException) {
            return StepError.nonRetryable(StepErrorType.CREDENTIAL_UNAVAILABLE, error.getMessage());
        }
        if (error instanceof ConditionEvaluationException) {
            return StepError.nonRetryable(StepErrorType.VALIDATION_ERROR, error.getMessage());
        }
        if (error instanceof StepExecutionException stepError) {
            StepErrorType type = stepError.getStatusCode() != null
                    ? StepErrorType.HTTP_ERROR
                    : stepError.isRetryable() ? StepErrorType.UNKNOWN : StepErrorType.VALIDATION_ERROR;
            return new StepError(type, stepError.getMessage(), stepError.isRetryable(), stepError.getStatusCode());
        }
        if (error instanceof CallNotPermittedException
                || error instanceof RequestNotPermitted
                || error instanceof BulkheadFullException) {
            return StepError.retryable(StepErrorType.RESILIENCE_REJECTED, error.getMessage());
        }
        if (error instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return new StepError(StepErrorType.HTTP_ERROR, "HTTP " + status + ": " + response.getStatusText(),
                    isRetryableStatus(status), status);
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return StepError.retryable(StepErrorType.NETWORK_ERROR, error.getMessage());
        }
        if (error instanceof IllegalArgumentException) {
            return StepError.nonRetryable(StepErrorType.VALIDATION_ERROR, error.getMessage());
        }
        return StepError.retryable(StepErrorType.UNKNOWN,
                error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
    }

    private boolean hasPermanentMarker(String message) {
        if (message == null) {
            return false;
        }
        String normalized = message.toUpperCase(Locale.ROOT);
        return PERMANENT_MARKERS.stream().anyMatch(normalized::contains);
    }

    private String describeBody(Object body) {
        if (body == null) {
            return "";
        }
        if (body instanceof Map<?, ?> map) {
            Object detail = map.containsKey("message") ? map.get("message") : map.get("error");
            if (detail != null) {
                return ": " + detail;
            }
        }
        String text = String.valueOf(body);
        return ": " + (text.length() > 200 ? text.substring(0, 200) + "..." : text);
    }
}
