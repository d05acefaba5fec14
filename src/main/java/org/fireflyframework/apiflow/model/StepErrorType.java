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
 * Classification of a step failure.
 */
public enum StepErrorType {

    /**
     * The step did not finish within its timeout.
     */
    TIMEOUT,

    /**
     * The remote API answered with a non-2xx status.
     */
    HTTP_ERROR,

    /**
     * Connection refused, reset, DNS failure and similar transport problems.
     */
    NETWORK_ERROR,

    /**
     * Malformed action, unresolvable parameters or invalid condition.
     */
    VALIDATION_ERROR,

    /**
     * The credential resolver could not produce a client for the connection.
     */
    CREDENTIAL_UNAVAILABLE,

    /**
     * Call rejected by a circuit breaker, rate limiter or bulkhead.
     */
    RESILIENCE_REJECTED,

    UNKNOWN
}
