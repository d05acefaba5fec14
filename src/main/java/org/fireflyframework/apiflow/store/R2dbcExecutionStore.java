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

import com.fasterxml.jackson.core.type.TypeReference;
import io.r2dbc.spi.Readable;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.condition.StepCondition;
import org.fireflyframework.apiflow.exception.StoreConsistencyException;
import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.ExecutionPlan;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.LogLevel;
import org.fireflyframework.apiflow.model.RetryState;
import org.fireflyframework.apiflow.model.StepResult;
import org.fireflyframework.apiflow.model.StepRetryConfig;
import org.fireflyframework.apiflow.model.Workflow;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import org.fireflyframework.apiflow.model.WorkflowStatus;
import org.fireflyframework.apiflow.model.WorkflowStep;
import org.springframework.lang.Nullable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * {@link ExecutionStore} on R2DBC using Spring's {@link DatabaseClient}.
 * <p>
 * Tables are defined in {@code db/apiflow-schema.sql}. Structured columns hold JSON
 * text. Executions carry a {@code version} column: every update is conditioned on
 * it, so of two writers racing on the same execution exactly one succeeds.
 */
@Slf4j
public class R2dbcExecutionStore implements ExecutionStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<StepResult>> STEP_RESULTS_TYPE = new TypeReference<>() {};

    private final DatabaseClient databaseClient;
    private final JsonColumnCodec json;
    @Nullable
    private final TransactionalOperator transactionalOperator;

    public R2dbcExecutionStore(DatabaseClient databaseClient,
                               JsonColumnCodec json,
                               @Nullable TransactionalOperator transactionalOperator) {
        this.databaseClient = databaseClient;
        this.json = json;
        this.transactionalOperator = transactionalOperator;
    }

    // ==================== Workflows ====================

    @Override
    public Mono<Workflow> saveWorkflow(Workflow workflow) {
        Instant now = Instant.now();
        Mono<Workflow> save = upsertWorkflow(workflow, now)
                .then(databaseClient.sql("DELETE FROM apiflow_workflow_steps WHERE workflow_id = :workflowId")
                        .bind("workflowId", workflow.id())
                        .fetch()
                        .rowsUpdated())
                .thenMany(Flux.fromIterable(workflow.steps()))
                .concatMap(step -> insertStep(workflow.id(), step))
                .then(Mono.just(workflow));

        return transactionalOperator != null ? save.as(transactionalOperator::transactional) : save;
    }

    private Mono<Long> upsertWorkflow(Workflow workflow, Instant now) {
        GenericExecuteSpec update = databaseClient.sql("""
                    UPDATE apiflow_workflows
                    SET user_id = :userId, name = :name, description = :description,
                        status = :status, updated_at = :updatedAt
                    WHERE id = :id
                    """)
                .bind("id", workflow.id())
                .bind("name", workflow.name() != null ? workflow.name() : workflow.id())
                .bind("status", workflow.status().name())
                .bind("updatedAt", now);
        update = bindNullable(update, "userId", workflow.userId(), String.class);
        update = bindNullable(update, "description", workflow.description(), String.class);

        return update.fetch().rowsUpdated()
                .flatMap(count -> count > 0 ? Mono.just(count) : insertWorkflow(workflow, now));
    }

    private Mono<Long> insertWorkflow(Workflow workflow, Instant now) {
        GenericExecuteSpec insert = databaseClient.sql("""
                    INSERT INTO apiflow_workflows (id, user_id, name, description, status, created_at, updated_at)
                    VALUES (:id, :userId, :name, :description, :status, :createdAt, :updatedAt)
                    """)
                .bind("id", workflow.id())
                .bind("name", workflow.name() != null ? workflow.name() : workflow.id())
                .bind("status", workflow.status().name())
                .bind("createdAt", workflow.createdAt() != null ? workflow.createdAt() : now)
                .bind("updatedAt", now);
        insert = bindNullable(insert, "userId", workflow.userId(), String.class);
        insert = bindNullable(insert, "description", workflow.description(), String.class);
        return insert.fetch().rowsUpdated();
    }

    private Mono<Long> insertStep(String workflowId, WorkflowStep step) {
        GenericExecuteSpec insert = databaseClient.sql("""
                    INSERT INTO apiflow_workflow_steps
                        (id, workflow_id, step_order, name, description, action, connection_ref,
                         parameters, conditions, retry_config, timeout_seconds, non_idempotent, active)
                    VALUES
                        (:id, :workflowId, :stepOrder, :name, :description, :action, :connectionRef,
                         :parameters, :conditions, :retryConfig, :timeoutSeconds, :nonIdempotent, :active)
                    """)
                .bind("id", step.id() != null ? step.id() : UUID.randomUUID().toString())
                .bind("workflowId", workflowId)
                .bind("stepOrder", step.stepOrder())
                .bind("name", step.name())
                .bind("action", step.action())
                .bind("parameters", json.write(step.parameters()))
                .bind("nonIdempotent", step.nonIdempotent())
                .bind("active", step.active());
        insert = bindNullable(insert, "description", step.description(), String.class);
        insert = bindNullable(insert, "connectionRef", step.connectionRef(), String.class);
        insert = bindNullable(insert, "conditions", json.write(step.conditions()), String.class);
        insert = bindNullable(insert, "retryConfig", json.write(step.retryConfig()), String.class);
        insert = bindNullable(insert, "timeoutSeconds", step.timeoutSeconds(), Integer.class);
        return insert.fetch().rowsUpdated();
    }

    @Override
    public Mono<Workflow> findWorkflow(String workflowId) {
        Mono<List<WorkflowStep>> steps = databaseClient.sql("""
                    SELECT * FROM apiflow_workflow_steps
                    WHERE workflow_id = :workflowId
                    ORDER BY step_order
                    """)
                .bind("workflowId", workflowId)
                .map(this::mapStep)
                .all()
                .collectList();

        return databaseClient.sql("SELECT * FROM apiflow_workflows WHERE id = :id")
                .bind("id", workflowId)
                .map(row -> new Workflow(
                        row.get("id", String.class),
                        row.get("user_id", String.class),
                        row.get("name", String.class),
                        row.get("description", String.class),
                        WorkflowStatus.valueOf(row.get("status", String.class)),
                        List.of(),
                        row.get("created_at", Instant.class),
                        row.get("updated_at", Instant.class)))
                .one()
                .zipWith(steps, (workflow, stepList) -> new Workflow(workflow.id(), workflow.userId(),
                        workflow.name(), workflow.description(), workflow.status(), stepList,
                        workflow.createdAt(), workflow.updatedAt()));
    }

    WorkflowStep mapStep(Readable row) {
        Boolean nonIdempotent = row.get("non_idempotent", Boolean.class);
        Boolean active = row.get("active", Boolean.class);
        return new WorkflowStep(
                row.get("id", String.class),
                row.get("workflow_id", String.class),
                row.get("step_order", Integer.class),
                row.get("name", String.class),
                row.get("description", String.class),
                row.get("action", String.class),
                row.get("connection_ref", String.class),
                json.read(row.get("parameters", String.class), MAP_TYPE),
                json.read(row.get("conditions", String.class), StepCondition.class),
                json.read(row.get("retry_config", String.class), StepRetryConfig.class),
                row.get("timeout_seconds", Integer.class),
                Boolean.TRUE.equals(nonIdempotent),
                active == null || active);
    }

    // ==================== Executions ====================

    @Override
    public Mono<WorkflowExecution> createExecution(WorkflowExecution execution) {
        WorkflowExecution stored = execution.withVersion(0);
        GenericExecuteSpec insert = databaseClient.sql("""
                    INSERT INTO apiflow_executions
                        (id, workflow_id, user_id, status, current_step, total_steps, completed_steps,
                         failed_steps, attempt_count, max_attempts, retry_after, queue_job_id, queue_name,
                         paused_at, paused_by, resumed_at, resumed_by, cancelled_at, cancelled_by,
                         parameters, plan, step_results, result, error, execution_time,
                         started_at, completed_at, created_at, updated_at, version)
                    VALUES
                        (:id, :workflowId, :userId, :status, :currentStep, :totalSteps, :completedSteps,
                         :failedSteps, :attemptCount, :maxAttempts, :retryAfter, :queueJobId, :queueName,
                         :pausedAt, :pausedBy, :resumedAt, :resumedBy, :cancelledAt, :cancelledBy,
                         :parameters, :plan, :stepResults, :result, :error, :executionTime,
                         :startedAt, :completedAt, :createdAt, :updatedAt, :version)
                    """)
                .bind("id", stored.id())
                .bind("workflowId", stored.workflowId())
                .bind("version", 0L);
        insert = bindNullable(insert, "createdAt", stored.createdAt(), Instant.class);

        return bindState(insert, stored)
                .fetch()
                .rowsUpdated()
                .thenReturn(stored);
    }

    @Override
    public Mono<WorkflowExecution> findExecution(String executionId) {
        return databaseClient.sql("SELECT * FROM apiflow_executions WHERE id = :id")
                .bind("id", executionId)
                .map(this::mapExecution)
                .one();
    }

    @Override
    public Mono<WorkflowExecution> compareAndSet(WorkflowExecution updated) {
        long expectedVersion = updated.version();
        WorkflowExecution next = updated.withVersion(expectedVersion + 1);

        GenericExecuteSpec update = databaseClient.sql("""
                    UPDATE apiflow_executions SET
                        user_id = :userId, status = :status, current_step = :currentStep,
                        total_steps = :totalSteps, completed_steps = :completedSteps,
                        failed_steps = :failedSteps, attempt_count = :attemptCount,
                        max_attempts = :maxAttempts, retry_after = :retryAfter,
                        queue_job_id = :queueJobId, queue_name = :queueName,
                        paused_at = :pausedAt, paused_by = :pausedBy,
                        resumed_at = :resumedAt, resumed_by = :resumedBy,
                        cancelled_at = :cancelledAt, cancelled_by = :cancelledBy,
                        parameters = :parameters, plan = :plan, step_results = :stepResults,
                        result = :result, error = :error, execution_time = :executionTime,
                        started_at = :startedAt, completed_at = :completedAt,
                        updated_at = :updatedAt, version = :newVersion
                    WHERE id = :id AND version = :expectedVersion
                    """)
                .bind("id", next.id())
                .bind("newVersion", next.version())
                .bind("expectedVersion", expectedVersion);

        return bindState(update, next)
                .fetch()
                .rowsUpdated()
                .flatMap(count -> {
                    if (count == 0) {
                        log.warn("STORE_CONFLICT: executionId={}, expectedVersion={}, status={}",
                                next.id(), expectedVersion, next.status());
                        return Mono.error(new StoreConsistencyException(next.id(), expectedVersion));
                    }
                    return Mono.just(next);
                });
    }

    private GenericExecuteSpec bindState(GenericExecuteSpec spec, WorkflowExecution execution) {
        RetryState retry = execution.retryState();
        GenericExecuteSpec bound = spec
                .bind("status", execution.status().name())
                .bind("totalSteps", execution.totalSteps())
                .bind("completedSteps", execution.completedSteps())
                .bind("failedSteps", execution.failedSteps())
                .bind("attemptCount", retry.attemptCount())
                .bind("maxAttempts", retry.maxAttempts())
                .bind("parameters", json.write(execution.parameters()))
                .bind("stepResults", json.write(execution.stepResults()));
        bound = bindNullable(bound, "userId", execution.userId(), String.class);
        bound = bindNullable(bound, "currentStep", execution.currentStep(), Integer.class);
        bound = bindNullable(bound, "retryAfter", retry.retryAfter(), Instant.class);
        bound = bindNullable(bound, "queueJobId", execution.queueJobId(), String.class);
        bound = bindNullable(bound, "queueName", execution.queueName(), String.class);
        bound = bindNullable(bound, "pausedAt", execution.pausedAt(), Instant.class);
        bound = bindNullable(bound, "pausedBy", execution.pausedBy(), String.class);
        bound = bindNullable(bound, "resumedAt", execution.resumedAt(), Instant.class);
        bound = bindNullable(bound, "resumedBy", execution.resumedBy(), String.class);
        bound = bindNullable(bound, "cancelledAt", execution.cancelledAt(), Instant.class);
        bound = bindNullable(bound, "cancelledBy", execution.cancelledBy(), String.class);
        bound = bindNullable(bound, "plan", json.write(execution.plan()), String.class);
        bound = bindNullable(bound, "result", json.write(execution.result()), String.class);
        bound = bindNullable(bound, "error", execution.error(), String.class);
        bound = bindNullable(bound, "executionTime", execution.executionTime(), Long.class);
        bound = bindNullable(bound, "startedAt", execution.startedAt(), Instant.class);
        bound = bindNullable(bound, "completedAt", execution.completedAt(), Instant.class);
        bound = bindNullable(bound, "updatedAt", execution.updatedAt(), Instant.class);
        return bound;
    }

    WorkflowExecution mapExecution(Readable row) {
        Integer attemptCount = row.get("attempt_count", Integer.class);
        Integer maxAttempts = row.get("max_attempts", Integer.class);
        Long version = row.get("version", Long.class);
        return WorkflowExecution.builder()
                .id(row.get("id", String.class))
                .workflowId(row.get("workflow_id", String.class))
                .userId(row.get("user_id", String.class))
                .status(ExecutionStatus.valueOf(row.get("status", String.class)))
                .currentStep(row.get("current_step", Integer.class))
                .totalSteps(intOrZero(row.get("total_steps", Integer.class)))
                .completedSteps(intOrZero(row.get("completed_steps", Integer.class)))
                .failedSteps(intOrZero(row.get("failed_steps", Integer.class)))
                .retryState(new RetryState(
                        intOrZero(attemptCount),
                        maxAttempts != null ? maxAttempts : RetryState.DEFAULT_MAX_ATTEMPTS,
                        row.get("retry_after", Instant.class)))
                .queueJobId(row.get("queue_job_id", String.class))
                .queueName(row.get("queue_name", String.class))
                .pausedAt(row.get("paused_at", Instant.class))
                .pausedBy(row.get("paused_by", String.class))
                .resumedAt(row.get("resumed_at", Instant.class))
                .resumedBy(row.get("resumed_by", String.class))
                .cancelledAt(row.get("cancelled_at", Instant.class))
                .cancelledBy(row.get("cancelled_by", String.class))
                .parameters(json.read(row.get("parameters", String.class), MAP_TYPE))
                .plan(json.read(row.get("plan", String.class), ExecutionPlan.class))
                .stepResults(json.read(row.get("step_results", String.class), STEP_RESULTS_TYPE))
                .result(json.read(row.get("result", String.class), Object.class))
                .error(row.get("error", String.class))
                .executionTime(row.get("execution_time", Long.class))
                .startedAt(row.get("started_at", Instant.class))
                .completedAt(row.get("completed_at", Instant.class))
                .createdAt(row.get("created_at", Instant.class))
                .updatedAt(row.get("updated_at", Instant.class))
                .version(version != null ? version : 0L)
                .build();
    }

    @Override
    public Flux<WorkflowExecution> findByWorkflowId(String workflowId) {
        return databaseClient.sql("""
                    SELECT * FROM apiflow_executions
                    WHERE workflow_id = :workflowId
                    ORDER BY created_at DESC
                    """)
                .bind("workflowId", workflowId)
                .map(this::mapExecution)
                .all();
    }

    @Override
    public Flux<WorkflowExecution> findStale(Set<ExecutionStatus> statuses, Instant updatedBefore) {
        if (statuses.isEmpty()) {
            return Flux.empty();
        }
        return databaseClient.sql("""
                    SELECT * FROM apiflow_executions
                    WHERE status IN (:statuses) AND updated_at < :cutoff
                    ORDER BY updated_at
                    """)
                .bind("statuses", statuses.stream().map(Enum::name).toList())
                .bind("cutoff", updatedBefore)
                .map(this::mapExecution)
                .all();
    }

    // ==================== Logs ====================

    @Override
    public Mono<ExecutionLog> appendLog(ExecutionLog entry) {
        ExecutionLog stored = entry.timestamp() != null ? entry : entry.withTimestamp(Instant.now());
        GenericExecuteSpec insert = databaseClient.sql("""
                    INSERT INTO apiflow_execution_logs
                        (execution_id, step_order, step_name, level, message, data, logged_at)
                    VALUES
                        (:executionId, :stepOrder, :stepName, :level, :message, :data, :loggedAt)
                    """)
                .bind("executionId", stored.executionId())
                .bind("level", stored.level().name())
                .bind("message", stored.message())
                .bind("data", json.write(stored.data()))
                .bind("loggedAt", stored.timestamp());
        insert = bindNullable(insert, "stepOrder", stored.stepOrder(), Integer.class);
        insert = bindNullable(insert, "stepName", stored.stepName(), String.class);
        return insert.fetch().rowsUpdated().thenReturn(stored);
    }

    @Override
    public Flux<ExecutionLog> findLogs(String executionId) {
        return databaseClient.sql("""
                    SELECT * FROM apiflow_execution_logs
                    WHERE execution_id = :executionId
                    ORDER BY logged_at, id
                    """)
                .bind("executionId", executionId)
                .map(row -> new ExecutionLog(
                        row.get("id", Long.class),
                        row.get("execution_id", String.class),
                        row.get("step_order", Integer.class),
                        row.get("step_name", String.class),
                        LogLevel.valueOf(row.get("level", String.class)),
                        row.get("message", String.class),
                        json.read(row.get("data", String.class), MAP_TYPE),
                        row.get("logged_at", Instant.class)))
                .all();
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return databaseClient.sql("SELECT 1 AS ok")
                .map(row -> row.get("ok", Integer.class))
                .one()
                .map(ok -> true)
                .timeout(Duration.ofSeconds(5))
                .onErrorResume(e -> {
                    log.warn("Execution store health check failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    private static GenericExecuteSpec bindNullable(GenericExecuteSpec spec, String name, Object value, Class<?> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }

    private static int intOrZero(Integer value) {
        return value != null ? value : 0;
    }
}
