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

package org.fireflyframework.apiflow.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.core.ExecutionWorker;
import org.fireflyframework.apiflow.queue.ExecutionQueue;
import org.fireflyframework.apiflow.queue.QueueStats;
import org.fireflyframework.apiflow.store.ExecutionStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Health indicator for the execution engine.
 * <p>
 * Reports the health status based on:
 * <ul>
 *   <li>Execution store connectivity</li>
 *   <li>Queue depth (ready, delayed and in-flight jobs)</li>
 *   <li>Whether this node's worker is consuming</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class ApiFlowHealthIndicator implements ReactiveHealthIndicator {

    private final ExecutionStore store;
    private final ExecutionQueue queue;
    @Nullable
    private final ExecutionWorker worker;

    @Override
    public Mono<Health> health() {
        return store.isHealthy()
                .timeout(Duration.ofSeconds(5))
                .onErrorReturn(false)
                .zipWith(queue.getStats().timeout(Duration.ofSeconds(5)))
                .map(tuple -> {
                    boolean storeHealthy = tuple.getT1();
                    QueueStats stats = tuple.getT2();

                    Health.Builder builder = storeHealthy ? Health.up() : Health.down();
                    return builder
                            .withDetail("executionStore", storeHealthy ? "connected" : "disconnected")
                            .withDetail("queue", queue.getQueueName())
                            .withDetail("queueReady", stats.ready())
                            .withDetail("queueDelayed", stats.delayed())
                            .withDetail("queueInFlight", stats.inFlight())
                            .withDetail("worker", worker == null ? "disabled"
                                    : worker.isRunning() ? "running" : "stopped")
                            .build();
                })
                .onErrorResume(e -> {
                    log.warn("Execution engine health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", String.valueOf(e.getMessage()))
                            .build());
                });
    }
}
