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

package org.fireflyframework.apiflow.recovery;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.metrics.ExecutionMetrics;
import org.fireflyframework.apiflow.model.ExecutionStatus;
import org.fireflyframework.apiflow.model.WorkflowExecution;
import org.fireflyframework.apiflow.queue.ExecutionQueue;
import org.fireflyframework.apiflow.store.ExecutionStore;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Re-enqueues executions whose job was lost.
 *
 * <p>On {@link ApplicationReadyEvent} and then every {@code scanInterval}, executions in
 * PENDING, RUNNING or RETRYING that have not been updated within the stale threshold are
 * put back on the queue under their persisted job id. Enqueueing an existing job id is a
 * no-op, so a job that is still queued or in flight is not duplicated. A PENDING
 * execution without a job id first gets one. PAUSED executions are left alone.</p>
 *
 * <p>Configuration:
 * <pre>
 * firefly.apiflow.recovery.enabled=true
 * firefly.apiflow.recovery.stale-threshold=PT30M
 * firefly.apiflow.recovery.scan-interval=PT5M
 * </pre>
 */
@Slf4j
public class ExecutionRecoveryService implements DisposableBean {

    private static final Set<ExecutionStatus> RECOVERABLE =
            EnumSet.of(ExecutionStatus.PENDING, ExecutionStatus.RUNNING, ExecutionStatus.RETRYING);

    private final ExecutionStore store;
    private final ExecutionQueue queue;
    @Nullable
    private final ExecutionMetrics metrics;
    private final boolean enabled;
    private final Duration staleThreshold;
    private final Duration scanInterval;
    private final Clock clock;

    private volatile Disposable periodicScan;

    public ExecutionRecoveryService(ExecutionStore store,
                                    ExecutionQueue queue,
                                    @Nullable ExecutionMetrics metrics,
                                    boolean enabled,
                                    Duration staleThreshold,
                                    Duration scanInterval,
                                    Clock clock) {
        this.store = store;
        this.queue = queue;
        this.metrics = metrics;
        this.enabled = enabled;
        this.staleThreshold = staleThreshold;
        this.scanInterval = scanInterval;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void recoverOnStartup() {
        if (!enabled) {
            log.info("Execution recovery is disabled");
            return;
        }
        if (periodicScan != null && !periodicScan.isDisposed()) {
            return;
        }

        log.info("Starting execution recovery (staleThreshold={}, scanInterval={})", staleThreshold, scanInterval);
        periodicScan = Flux.interval(Duration.ZERO, scanInterval)
                .onBackpressureDrop()
                .concatMap(tick -> recoverStale()
                        .onErrorResume(e -> {
                            log.error("Execution recovery scan failed", e);
                            return Mono.empty();
                        }))
                .subscribe();
    }

    /**
     * Runs one recovery scan.
     *
     * @return the number of executions put back on the queue
     */
    public Mono<Long> recoverStale() {
        Instant cutoff = clock.instant().minus(staleThreshold);
        AtomicLong recovered = new AtomicLong();
        AtomicLong failed = new AtomicLong();

        return store.findStale(RECOVERABLE, cutoff)
                .concatMap(execution -> recover(execution)
                        .doOnSuccess(v -> recovered.incrementAndGet())
                        .onErrorResume(e -> {
                            failed.incrementAndGet();
                            log.error("Failed to recover execution {}: {}", execution.id(), e.getMessage());
                            return Mono.empty();
                        }))
                .then(Mono.fromSupplier(() -> {
                    if (recovered.get() > 0 || failed.get() > 0) {
                        log.info("Execution recovery complete: recovered={}, failed={}", recovered.get(), failed.get());
                    }
                    if (metrics != null && recovered.get() > 0) {
                        metrics.recordRecovered((int) recovered.get());
                    }
                    return recovered.get();
                }));
    }

    private Mono<Void> recover(WorkflowExecution execution) {
        if (execution.queueJobId() == null) {
            String jobId = queue.newJobId();
            log.info("RECOVERY_ASSIGN_JOB: executionId={}, status={}, jobId={}",
                    execution.id(), execution.status(), jobId);
            return store.compareAndSet(execution.assignJob(jobId, queue.getQueueName(), clock.instant()))
                    .flatMap(this::requeue);
        }
        return requeue(execution);
    }

    private Mono<Void> requeue(WorkflowExecution execution) {
        log.info("RECOVERY_REQUEUE: executionId={}, status={}, currentStep={}, jobId={}, updatedAt={}",
                execution.id(), execution.status(), execution.currentStep(), execution.queueJobId(),
                execution.updatedAt());
        Instant retryAfter = execution.retryState().retryAfter();
        Mono<String> enqueue = retryAfter != null
                ? queue.enqueueDelayed(execution.queueJobId(), execution.id(), retryAfter)
                : queue.enqueue(execution.queueJobId(), execution.id());
        return enqueue.then();
    }

    public synchronized void stop() {
        if (periodicScan != null && !periodicScan.isDisposed()) {
            log.info("Stopping execution recovery");
            periodicScan.dispose();
            periodicScan = null;
        }
    }

    @Override
    public void destroy() {
        stop();
    }
}
