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
 * Lifecycle state of a {@link WorkflowExecution}.
 */
public enum ExecutionStatus {

    /**
     * Created or resumed, waiting for a worker to pick up its queue job.
     */
    PENDING,

    /**
     * A worker holds the execution's queue job and is running steps.
     */
    RUNNING,

    /**
     * Paused by an operator. Resuming moves it back to PENDING.
     */
    PAUSED,

    /**
     * The current step failed and a delayed redelivery is scheduled.
     */
    RETRYING,

    /**
     * All steps succeeded or were skipped.
     */
    COMPLETED,

    /**
     * A step failed permanently or exhausted its attempts.
     */
    FAILED,

    /**
     * Cancelled by an operator.
     */
    CANCELLED;

    /**
     * Checks if the execution is in a terminal state.
     *
     * @return true if no further transition is accepted
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if a delivered queue job may drive this execution.
     *
     * @return true if the coordinator may run steps for it
     */
    public boolean acceptsDelivery() {
        return this == PENDING || this == RUNNING || this == RETRYING;
    }

    /**
     * Checks if the execution can be paused.
     *
     * @return true if pausing is allowed
     */
    public boolean canPause() {
        return this == PENDING || this == RUNNING || this == RETRYING;
    }

    /**
     * Checks if the execution can be resumed.
     *
     * @return true if resuming is allowed
     */
    public boolean canResume() {
        return this == PAUSED;
    }
}
