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

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link ExecutionQueue} for single-node deployments and tests.
 * <p>
 * Provides:
 * <ul>
 *   <li>Delayed delivery via a visibility time per job</li>
 *   <li>Visibility timeout with automatic redelivery of unacknowledged jobs</li>
 *   <li>Idempotent enqueue by job id</li>
 * </ul>
 * Jobs are lost on restart; the recovery service re-enqueues executions whose job vanished.
 * <p>
 * Thread Safety: This class is thread-safe.
 */
@Slf4j
public class InMemoryExecutionQueue implements ExecutionQueue {

    private static final String DEFAULT_QUEUE_NAME = "workflow-execution";
    private static final Duration DEFAULT_VISIBILITY_TIMEOUT = Duration.ofMinutes(10);
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

    private final String queueName;
    private final Duration visibilityTimeout;
    private final Duration pollInterval;
    private final Clock clock;

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    @Builder
    public InMemoryExecutionQueue(String queueName,
                                  Duration visibilityTimeout,
                                  Duration pollInterval,
                                  Clock clock) {
        this.queueName = queueName != null ? queueName : DEFAULT_QUEUE_NAME;
        this.visibilityTimeout = visibilityTimeout != null ? visibilityTimeout : DEFAULT_VISIBILITY_TIMEOUT;
        this.pollInterval = pollInterval != null ? pollInterval : DEFAULT_POLL_INTERVAL;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public String getQueueName() {
        return queueName;
    }

    @Override
    public Mono<String> enqueue(String jobId, String executionId) {
        return Mono.fromSupplier(() -> put(jobId, executionId, clock.instant()));
    }

    @Override
    public Mono<String> enqueueDelayed(String jobId, String executionId, Instant notBefore) {
        return Mono.fromSupplier(() -> put(jobId, executionId, notBefore));
    }

    private String put(String jobId, String executionId, Instant visibleAt) {
        if (jobId == null || executionId == null) {
            throw new QueueException("jobId and executionId are required");
        }
        Job existing = jobs.putIfAbsent(jobId, new Job(jobId, executionId, visibleAt));
        if (existing != null) {
            log.debug("QUEUE_DUPLICATE: queue={}, jobId={}, executionId={}", queueName, jobId, executionId);
        } else {
            log.debug("QUEUE_ENQUEUE: queue={}, jobId={}, executionId={}, notBefore={}",
                    queueName, jobId, executionId, visibleAt);
        }
        return jobId;
    }

    @Override
    public Mono<Void> ack(String jobId) {
        return Mono.fromRunnable(() -> {
            if (jobs.remove(jobId) != null) {
                log.debug("QUEUE_ACK: queue={}, jobId={}", queueName, jobId);
            }
        });
    }

    @Override
    public Mono<Void> nack(String jobId, Instant redeliverAfter) {
        return Mono.fromRunnable(() -> {
            Job job = jobs.get(jobId);
            if (job == null) {
                return;
            }
            synchronized (job) {
                job.inFlight = false;
                job.visibleAt = redeliverAfter != null ? redeliverAfter : clock.instant();
            }
            log.debug("QUEUE_NACK: queue={}, jobId={}, redeliverAfter={}", queueName, jobId, job.visibleAt);
        });
    }

    @Override
    public Mono<Boolean> extendVisibility(String jobId) {
        return Mono.fromSupplier(() -> {
            Job job = jobId != null ? jobs.get(jobId) : null;
            if (job == null) {
                return false;
            }
            synchronized (job) {
                if (!job.inFlight) {
                    return false;
                }
                job.visibleAt = clock.instant().plus(visibilityTimeout);
            }
            log.trace("QUEUE_EXTEND: queue={}, jobId={}, visibleAt={}", queueName, jobId, job.visibleAt);
            return true;
        });
    }

    @Override
    public Mono<Boolean> cancel(String jobId) {
        return Mono.fromSupplier(() -> {
            boolean removed = jobId != null && jobs.remove(jobId) != null;
            if (removed) {
                log.debug("QUEUE_CANCEL: queue={}, jobId={}", queueName, jobId);
            }
            return removed;
        });
    }

    /**
     * Claims up to {@code max} due jobs: jobs whose delivery time has come, and
     * delivered jobs whose visibility timeout expired without acknowledgement.
     * Used by the poller started in {@link #subscribe}.
     *
     * @param max maximum number of deliveries
     * @return the claimed deliveries, oldest first
     */
    public List<QueueDelivery> pollDue(int max) {
        if (max <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        return jobs.values().stream()
                .filter(job -> !job.visibleAt.isAfter(now))
                .sorted(Comparator.comparing((Job job) -> job.visibleAt))
                .map(job -> claim(job, now))
                .filter(delivery -> delivery != null)
                .limit(max)
                .toList();
    }

    private QueueDelivery claim(Job job, Instant now) {
        synchronized (job) {
            if (job.visibleAt.isAfter(now) || !jobs.containsKey(job.jobId)) {
                return null;
            }
            if (job.inFlight) {
                log.warn("QUEUE_REDELIVER: queue={}, jobId={}, executionId={}, deliveryCount={}",
                        queueName, job.jobId, job.executionId, job.deliveryCount);
            }
            job.inFlight = true;
            job.deliveryCount++;
            job.visibleAt = now.plus(visibilityTimeout);
            return new QueueDelivery(job.jobId, job.executionId, queueName, job.deliveryCount, now);
        }
    }

    @Override
    public Disposable subscribe(JobHandler handler, int concurrency) {
        if (!running.compareAndSet(false, true)) {
            throw new QueueException("Queue '" + queueName + "' already has a subscriber");
        }
        log.info("Starting in-memory execution queue: queue={}, concurrency={}, pollInterval={}, visibilityTimeout={}",
                queueName, concurrency, pollInterval, visibilityTimeout);

        AtomicInteger active = new AtomicInteger();
        Disposable poller = Flux.interval(pollInterval, Schedulers.boundedElastic())
                .onBackpressureDrop()
                .concatMapIterable(tick -> {
                    List<QueueDelivery> due = pollDue(concurrency - active.get());
                    active.addAndGet(due.size());
                    return due;
                })
                .flatMap(delivery -> handler.onDelivery(delivery)
                        .doOnError(e -> log.error("QUEUE_HANDLER_ERROR: queue={}, jobId={}, executionId={}",
                                queueName, delivery.jobId(), delivery.executionId(), e))
                        .onErrorResume(e -> Mono.empty())
                        .doFinally(signal -> active.decrementAndGet()), concurrency)
                .subscribe();

        return () -> {
            poller.dispose();
            running.set(false);
            log.info("Stopped in-memory execution queue: queue={}", queueName);
        };
    }

    @Override
    public Mono<QueueStats> getStats() {
        return Mono.fromSupplier(() -> {
            Instant now = clock.instant();
            int ready = 0;
            int delayed = 0;
            int inFlight = 0;
            for (Job job : jobs.values()) {
                if (job.inFlight) {
                    inFlight++;
                } else if (job.visibleAt.isAfter(now)) {
                    delayed++;
                } else {
                    ready++;
                }
            }
            return new QueueStats(ready, delayed, inFlight);
        });
    }

    private static final class Job {
        private final String jobId;
        private final String executionId;
        private volatile Instant visibleAt;
        private volatile boolean inFlight;
        private int deliveryCount;

        private Job(String jobId, String executionId, Instant visibleAt) {
            this.jobId = jobId;
            this.executionId = executionId;
            this.visibleAt = visibleAt;
        }
    }
}
