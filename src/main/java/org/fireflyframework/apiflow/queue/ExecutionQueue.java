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

package org.fireflyframework.apiflow.queue;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable job queue carrying execution ids to workers.
 * <p>
 * Delivery is at-least-once: a job that is not acknowledged within the queue's
 * visibility window is delivered again. Job ids are chosen by the caller so the
 * engine can persist a job id before the job becomes deliverable; enqueueing an
 * id that is still outstanding is a no-op.
 */
public interface ExecutionQueue {

    /**
     * Gets the name of the queue jobs are placed on.
     */
    String getQueueName();

    /**
     * Allocates a new job id.
     */
    default String newJobId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Enqueues a job deliverable immediately.
     *
     * @param jobId the job id
     * @param executionId the execution to drive
     * @return the job id
     */
    Mono<String> enqueue(String jobId, String executionId);

    /**
     * Enqueues a job that is not delivered before {@code notBefore}.
     *
     * @param jobId the job id
     * @param executionId the execution to drive
     * @param notBefore earliest delivery time
     * @return the job id
     */
    Mono<String> enqueueDelayed(String jobId, String executionId, Instant notBefore);

    default Mono<String> enqueue(String executionId) {
        return enqueue(newJobId(), executionId);
    }

    default Mono<String> enqueueDelayed(String executionId, Instant notBefore) {
        return enqueueDelayed(newJobId(), executionId, notBefore);
    }

    /**
     * Acknowledges a delivered job; it is never delivered again.
     */
    Mono<Void> ack(String jobId);

    /**
     * Returns a delivered job to the queue, deliverable again at {@code redeliverAfter}.
     */
    Mono<Void> nack(String jobId, Instant redeliverAfter);

    /**
     * Keeps a delivered job hidden for another visibility window, for workers whose
     * step outlasts the window.
     *
     * @return false if the job is no longer outstanding or not in flight
     */
    Mono<Boolean> extendVisibility(String jobId);

    /**
     * Removes a job that has not been acknowledged yet.
     *
     * @return true if the job existed
     */
    Mono<Boolean> cancel(String jobId);

    /**
     * Starts delivering jobs to {@code handler}.
     *
     * @param handler the delivery callback, it acknowledges jobs itself
     * @param concurrency maximum deliveries handled at once
     * @return handle that stops the delivery
     */
    Disposable subscribe(JobHandler handler, int concurrency);

    Mono<QueueStats> getStats();
}
