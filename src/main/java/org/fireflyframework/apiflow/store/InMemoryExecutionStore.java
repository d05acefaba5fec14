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

import org.fireflyframework.apiflow.exception.StoreConsistencyException;
import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.Workflow;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ExecutionStore} keeping everything in memory.
 * <p>
 * Suitable for tests and single-node setups without a database. Log timestamps
 * are kept monotonic per execution: an entry older than the last one written
 * for the same execution takes the last entry's timestamp.
 */
public class InMemoryExecutionStore implements ExecutionStore {

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();
    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final Map<String, List<ExecutionLog>> logs = new ConcurrentHashMap<>();
    private final AtomicLong logSequence = new AtomicLong();

    @Override
    public Mono<Workflow> saveWorkflow(Workflow workflow) {
        return Mono.fromSupplier(() -> {
            workflows.put(workflow.id(), workflow);
            return workflow;
        });
    }

    @Override
    public Mono<Workflow> findWorkflow(String workflowId) {
        return Mono.justOrEmpty(workflows.get(workflowId));
    }

    @Override
    public Mono<WorkflowExecution> createExecution(WorkflowExecution execution) {
        return Mono.fromSupplier(() -> {
            WorkflowExecution stored = execution.withVersion(0);
            if (executions.putIfAbsent(execution.id(), stored) != null) {
                throw new IllegalArgumentException("Execution already exists: " + execution.id());
            }
            return stored;
        });
    }

    @Override
    public Mono<WorkflowExecution> findExecution(String executionId) {
        return Mono.justOrEmpty(executions.get(executionId));
    }

    @Override
    public Mono<WorkflowExecution> compareAndSet(WorkflowExecution updated) {
        return Mono.fromSupplier(() -> {
            AtomicReference<WorkflowExecution> written = new AtomicReference<>();
            executions.computeIfPresent(updated.id(), (id, current) -> {
                if (current.version() != updated.version()) {
                    return current;
                }
                WorkflowExecution next = updated.withVersion(updated.version() + 1);
                written.set(next);
                return next;
            });
            if (written.get() == null) {
                throw new StoreConsistencyException(updated.id(), updated.version());
            }
            return written.get();
        });
    }

    @Override
    public Flux<WorkflowExecution> findByWorkflowId(String workflowId) {
        return Flux.defer(() -> Flux.fromIterable(executions.values().stream()
                .filter(e -> e.workflowId().equals(workflowId))
                .sorted(Comparator.comparing(WorkflowExecution::createdAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList()));
    }

    @Override
    public Flux<WorkflowExecution> findStale(Set<ExecutionStatus> statuses, Instant updatedBefore) {
        return Flux.defer(() -> Flux.fromIterable(executions.values().stream()
                .filter(e -> statuses.contains(e.status()))
                .filter(e -> e.updatedAt() == null || e.updatedAt().isBefore(updatedBefore))
                .sorted(Comparator.comparing(WorkflowExecution::updatedAt,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList()));
    }

    @Override
    public Mono<ExecutionLog> appendLog(ExecutionLog entry) {
        return Mono.fromSupplier(() -> {
            List<ExecutionLog> entries = logs.computeIfAbsent(entry.executionId(), id -> new ArrayList<>());
            synchronized (entries) {
                Instant timestamp = entry.timestamp() != null ? entry.timestamp() : Instant.now();
                if (!entries.isEmpty()) {
                    Instant last = entries.get(entries.size() - 1).timestamp();
                    if (timestamp.isBefore(last)) {
                        timestamp = last;
                    }
                }
                ExecutionLog stored = entry.withId(logSequence.incrementAndGet()).withTimestamp(timestamp);
                entries.add(stored);
                return stored;
            }
        });
    }

    @Override
    public Flux<ExecutionLog> findLogs(String executionId) {
        return Flux.defer(() -> {
            List<ExecutionLog> entries = logs.getOrDefault(executionId, List.of());
            synchronized (entries) {
                return Flux.fromIterable(List.copyOf(entries));
            }
        });
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }
}
