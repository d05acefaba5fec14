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

package org.fireflyframework.apiflow.core;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.exception.WorkflowNotActiveException;
import org.fireflyframework.apiflow.exception.WorkflowNotFoundException;
import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.LogLevel;
import org.fireflyframework.apiflow.model.Workflow;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import org.fireflyframework.apiflow.queue.ExecutionQueue;
import org.fireflyframework.apiflow.store.ExecutionStore;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Creates PENDING executions and enqueues their first job.
 * <p>
 * The job id is allocated here and stored with the execution before the job is
 * enqueued, so a delivery can never arrive ahead of the id it is checked against.
 */
@Slf4j
public class ExecutionSubmitter {

    private final ExecutionStore store;
    private final ExecutionQueue queue;
    private final int defaultMaxAttempts;
    private final Clock clock;

    public ExecutionSubmitter(ExecutionStore store, ExecutionQueue queue, int defaultMaxAttempts, Clock clock) {
        this.store = store;
        this.queue = queue;
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.clock = clock;
    }

    /**
     * Submits a new execution of a workflow.
     *
     * @param workflowId the workflow to run
     * @param userId the submitting user
     * @param parameters input parameters, may be null
     * @param maxAttempts attempts per step, null for the configured default
     * @return the created execution
     */
    public Mono<WorkflowExecution> submit(String workflowId, String userId,
                                         Map<String, Object> parameters, Integer maxAttempts) {
        return store.findWorkflow(workflowId)
                .switchIfEmpty(Mono.error(() -> new WorkflowNotFoundException(workflowId)))
                .flatMap(workflow -> create(workflow, userId, parameters, maxAttempts));
    }

    public Mono<WorkflowExecution> submit(String workflowId, String userId, Map<String, Object> parameters) {
        return submit(workflowId, userId, parameters, null);
    }

    private Mono<WorkflowExecution> create(Workflow workflow, String userId,
                                           Map<String, Object> parameters, Integer maxAttempts) {
        if (!workflow.isActive()) {
            return Mono.error(new WorkflowNotActiveException(workflow.id(), workflow.status()));
        }
        int attempts = maxAttempts != null ? maxAttempts : defaultMaxAttempts;
        if (attempts < 1) {
            return Mono.error(new IllegalArgumentException("maxAttempts must be at least 1"));
        }

        Instant now = clock.instant();
        String jobId = queue.newJobId();
        WorkflowExecution execution = WorkflowExecution.pending(UUID.randomUUID().toString(), workflow,
                userId, parameters, attempts, jobId, queue.getQueueName(), now);

        return store.createExecution(execution)
                .flatMap(created -> store.appendLog(ExecutionLog.builder()
                                .executionId(created.id())
                                .level(LogLevel.INFO)
                                .message("Execution submitted")
                                .data(Map.of("workflowId", workflow.id(), "totalSteps", created.totalSteps()))
                                .timestamp(now)
                                .build())
                        .then(queue.enqueue(jobId, created.id()))
                        .thenReturn(created))
                .doOnSuccess(created -> log.info(
                        "EXECUTION_SUBMITTED: executionId={}, workflowId={}, userId={}, totalSteps={}, jobId={}",
                        created.id(), workflow.id(), userId, created.totalSteps(), jobId));
    }
}
