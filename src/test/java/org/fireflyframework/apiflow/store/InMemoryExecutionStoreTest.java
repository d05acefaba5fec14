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

import org.fireflyframework.apiflow.TestWorkflows;
import org.fireflyframework.apiflow.exception.StoreConsistencyException;
import org.fireflyframework.apiflow.model.ExecutionLog;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.LogLevel;
import org.fireflyframework.apiflow.model.Workflow;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for InMemoryExecutionStore.
 */
class InMemoryExecutionStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryExecutionStore store;
    private Workflow workflow;

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionStore();
        workflow = TestWorkflows.activeWithSteps(2);
        store.saveWorkflow(workflow).block();
    }

    private WorkflowExecution pending(String id, Instant createdAt) {
        return WorkflowExecution.pending(id, workflow, "user-1", Map.of(), 3, "job-" + id, "q", createdAt);
    }

    @Test
    void shouldFindSavedWorkflow() {
        StepVerifier.create(store.findWorkflow(TestWorkflows.WORKFLOW_ID))
                .expectNext(workflow)
                .verifyComplete();

        StepVerifier.create(store.findWorkflow("missing"))
                .verifyComplete();
    }

    @Nested
    @DisplayName("compare-and-set")
    class CompareAndSet {

        @Test
        void createStartsAtVersionZero() {
            StepVerifier.create(store.createExecution(pending("exec-1", T0).withVersion(7)))
                    .assertNext(stored -> assertThat(stored.version()).isZero())
                    .verifyComplete();
        }

        @Test
        void createRejectsDuplicateId() {
            store.createExecution(pending("exec-1", T0)).block();

            StepVerifier.create(store.createExecution(pending("exec-1", T0)))
                    .expectError(IllegalArgumentException.class)
                    .verify();
        }

        @Test
        void updateIncrementsVersion() {
            WorkflowExecution created = store.createExecution(pending("exec-1", T0)).block();

            StepVerifier.create(store.compareAndSet(created.start(workflow.toPlan(), "job-exec-1", T0)))
                    .assertNext(updated -> {
                        assertThat(updated.version()).isEqualTo(1);
                        assertThat(updated.status()).isEqualTo(ExecutionStatus.RUNNING);
                    })
                    .verifyComplete();

            StepVerifier.create(store.findExecution("exec-1"))
                    .assertNext(found -> assertThat(found.version()).isEqualTo(1))
                    .verifyComplete();
        }

        @Test
        void exactlyOneOfTwoRacingWritersWins() {
            WorkflowExecution created = store.createExecution(pending("exec-1", T0)).block();

            store.compareAndSet(created.pause("alice", T0)).block();

            StepVerifier.create(store.compareAndSet(created.cancel("bob", T0)))
                    .expectError(StoreConsistencyException.class)
                    .verify();
            StepVerifier.create(store.findExecution("exec-1"))
                    .assertNext(found -> assertThat(found.status()).isEqualTo(ExecutionStatus.PAUSED))
                    .verifyComplete();
        }

        @Test
        void updateOfMissingExecutionConflicts() {
            StepVerifier.create(store.compareAndSet(pending("ghost", T0)))
                    .expectError(StoreConsistencyException.class)
                    .verify();
        }
    }

    @Test
    void shouldListExecutionsNewestFirst() {
        store.createExecution(pending("exec-old", T0)).block();
        store.createExecution(pending("exec-new", T0.plusSeconds(60))).block();

        StepVerifier.create(store.findByWorkflowId(TestWorkflows.WORKFLOW_ID).map(WorkflowExecution::id))
                .expectNext("exec-new", "exec-old")
                .verifyComplete();
    }

    @Test
    void shouldFindStaleExecutionsByStatusAndAge() {
        store.createExecution(pending("exec-stale", T0)).block();
        store.createExecution(pending("exec-fresh", T0.plusSeconds(3600))).block();
        WorkflowExecution paused = store.createExecution(pending("exec-paused", T0)).block();
        store.compareAndSet(paused.pause("alice", T0)).block();

        Set<ExecutionStatus> statuses = EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING);

        StepVerifier.create(store.findStale(statuses, T0.plusSeconds(60)).map(WorkflowExecution::id))
                .expectNext("exec-stale")
                .verifyComplete();
    }

    @Test
    void shouldAppendLogsInOrderWithMonotonicTimestamps() {
        store.appendLog(ExecutionLog.builder().executionId("exec-1").level(LogLevel.INFO)
                .message("first").timestamp(T0.plusSeconds(5)).build()).block();
        store.appendLog(ExecutionLog.builder().executionId("exec-1").level(LogLevel.WARNING)
                .message("second").timestamp(T0).build()).block();
        store.appendLog(ExecutionLog.builder().executionId("exec-2").level(LogLevel.INFO)
                .message("other").build()).block();

        StepVerifier.create(store.findLogs("exec-1"))
                .assertNext(entry -> {
                    assertThat(entry.message()).isEqualTo("first");
                    assertThat(entry.id()).isNotNull();
                })
                .assertNext(entry -> {
                    assertThat(entry.message()).isEqualTo("second");
                    assertThat(entry.timestamp()).isEqualTo(T0.plusSeconds(5));
                })
                .verifyComplete();

        StepVerifier.create(store.findLogs("exec-unknown")).verifyComplete();
    }
}
