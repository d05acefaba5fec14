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
import org.fireflyframework.apiflow.queue.ExecutionQueue;
import org.fireflyframework.apiflow.queue.JobHandler;
import org.fireflyframework.apiflow.queue.QueueDelivery;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Consumes execution jobs from the {@link ExecutionQueue} and hands each delivery to the
 * {@link ExecutionCoordinator}.
 * <p>
 * The coordinator's {@link DeliveryOutcome} decides the queue call: ACK acknowledges,
 * DEFER negatively acknowledges until the given time, ABANDON leaves the job in flight
 * so it is redelivered once its visibility timeout expires. Unexpected errors are
 * treated like ABANDON.
 * <p>
 * While a delivery is being handled the worker extends the job's visibility every
 * heartbeat interval, so a step that runs longer than the visibility timeout is not
 * handed to a second worker. A worker that dies stops the heartbeat and the job is
 * redelivered.
 */
@Slf4j
public class ExecutionWorker implements JobHandler, DisposableBean {

    private final ExecutionQueue queue;
    private final ExecutionCoordinator coordinator;
    private final int concurrency;
    @Nullable
    private final Duration heartbeatInterval;

    private volatile Disposable subscription;

    public ExecutionWorker(ExecutionQueue queue, ExecutionCoordinator coordinator, int concurrency) {
        this(queue, coordinator, concurrency, null);
    }

    /**
     * @param heartbeatInterval how often to extend the visibility of a job being handled,
     *                          null to never extend it
     */
    public ExecutionWorker(ExecutionQueue queue, ExecutionCoordinator coordinator, int concurrency,
                           @Nullable Duration heartbeatInterval) {
        this.queue = queue;
        this.coordinator = coordinator;
        this.concurrency = concurrency;
        this.heartbeatInterval = heartbeatInterval;
    }

    public synchronized void start() {
        if (isRunning()) {
            log.warn("Execution worker is already running");
            return;
        }
        log.info("Starting execution worker: queue={}, concurrency={}", queue.getQueueName(), concurrency);
        subscription = queue.subscribe(this, concurrency);
    }

    /**
     * Stops consuming. Safe to call multiple times or before {@link #start()}.
     */
    public synchronized void stop() {
        if (isRunning()) {
            log.info("Stopping execution worker: queue={}", queue.getQueueName());
            subscription.dispose();
            subscription = null;
        }
    }

    public boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }

    @Override
    public Mono<Void> onDelivery(QueueDelivery delivery) {
        Mono<Void> handled = coordinator.handle(delivery)
                .flatMap(outcome -> settle(delivery, outcome))
                .onErrorResume(e -> {
                    log.error("DELIVERY_ERROR: executionId={}, jobId={}, job left for redelivery",
                            delivery.executionId(), delivery.jobId(), e);
                    return Mono.empty();
                });
        if (heartbeatInterval == null) {
            return handled;
        }
        return Mono.using(() -> startHeartbeat(delivery), heartbeat -> handled, Disposable::dispose);
    }

    private Disposable startHeartbeat(QueueDelivery delivery) {
        return Flux.interval(heartbeatInterval)
                .concatMap(tick -> queue.extendVisibility(delivery.jobId())
                        .onErrorResume(e -> {
                            log.warn("DELIVERY_HEARTBEAT_FAILED: executionId={}, jobId={}, error={}",
                                    delivery.executionId(), delivery.jobId(), e.getMessage());
                            return Mono.just(true);
                        }))
                .takeUntil(extended -> !extended)
                .subscribe(extended -> log.trace("DELIVERY_HEARTBEAT: executionId={}, jobId={}, extended={}",
                        delivery.executionId(), delivery.jobId(), extended));
    }

    private Mono<Void> settle(QueueDelivery delivery, DeliveryOutcome outcome) {
        log.debug("DELIVERY_OUTCOME: executionId={}, jobId={}, action={}, reason={}",
                delivery.executionId(), delivery.jobId(), outcome.action(), outcome.reason());
        return switch (outcome.action()) {
            case ACK -> queue.ack(delivery.jobId());
            case DEFER -> queue.nack(delivery.jobId(), outcome.redeliverAfter());
            case ABANDON -> {
                log.warn("DELIVERY_ABANDONED: executionId={}, jobId={}, reason={}",
                        delivery.executionId(), delivery.jobId(), outcome.reason());
                yield Mono.empty();
            }
        };
    }

    @Override
    public void destroy() {
        stop();
    }
}
