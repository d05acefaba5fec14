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

package org.fireflyframework.apiflow.store;

import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.Workflow;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Set;

/**
 * Durable storage of workflows, executions and execution logs.
 * <p>
 * Executions are only ever modified through {@link #compareAndSet}, which
 * applies a write only if the stored version still equals the version the
 * caller read. This is the single concurrency control between workers and the
 * control API; no locks are held.
 */
public interface ExecutionStore {

    /**
     * Creates or replaces a workflow together with its steps.
     *
     * @param workflow the workflow
     * @return the saved workflow
     */
    Mono<Workflow> saveWorkflow(Workflow workflow);

    /**
     * Finds a workflow with its steps in step order.
     *
     * @param workflowId the workflow ID
     * @return a Mono containing the workflow if found
     */
    Mono<Workflow> findWorkflow(String workflowId);

    /**
     * Inserts a new execution with version 0.
     *
     * @param execution the execution
     * @return the stored execution
     */
    Mono<WorkflowExecution> createExecution(WorkflowExecution execution);

    /**
     * Finds an execution by its ID.
     *
     * @param executionId the execution ID
     * @return a Mono containing the execution if found
     */
    Mono<WorkflowExecution> findExecution(String executionId);

    /**
     * Writes {@code updated} if the stored version equals {@code updated.version()}.
     *
     * @param updated the new state, carrying the version it was derived from
     * @return the stored state with the incremented version, or
     *         {@link org.fireflyframework.apiflow.exception.StoreConsistencyException}
     *         if the execution changed or disappeared in between
     */
    Mono<WorkflowExecution> compareAndSet(WorkflowExecution updated);

    /**
     * Finds all executions of a workflow.
     *
     * @param workflowId the workflow ID
     * @return executions, newest first
     */
    Flux<WorkflowExecution> findByWorkflowId(String workflowId);

    /**
     * Finds executions in one of the given statuses not updated since {@code updatedBefore}.
     *
     * @param statuses statuses to match
     * @param updatedBefore cutoff time
     * @return matching executions, oldest update first
     */
    Flux<WorkflowExecution> findStale(Set<ExecutionStatus> statuses, Instant updatedBefore);

    /**
     * Appends a log entry. Entries are never updated or deleted.
     *
     * @param entry the entry
     * @return the stored entry
     */
    Mono<ExecutionLog> appendLog(ExecutionLog entry);

    /**
     * Finds the log of an execution ordered by timestamp, then insertion order.
     *
     * @param executionId the execution ID
     * @return the entries
     */
    Flux<ExecutionLog> findLogs(String executionId);

    /**
     * Checks if the store is reachable.
     *
     * @return true if healthy
     */
    Mono<Boolean> isHealthy();
}
