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

package org.fireflyframework.apiflow.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.apiflow.client.CredentialResolver;
import org.fireflyframework.apiflow.control.ExecutionControlService;
import org.fireflyframework.apiflow.core.ExecutionCoordinator;
import org.fireflyframework.apiflow.core.ExecutionSubmitter;
import org.fireflyframework.apiflow.core.ExecutionWorker;
import org.fireflyframework.apiflow.exception.CredentialUnavailableException;
import org.fireflyframework.apiflow.health.ApiFlowHealthIndicator;
import org.fireflyframework.apiflow.metrics.ExecutionMetrics;
import org.fireflyframework.apiflow.properties.ApiFlowProperties;
import org.fireflyframework.apiflow.queue.ExecutionQueue;
import org.fireflyframework.apiflow.recovery.ExecutionRecoveryService;
import org.fireflyframework.apiflow.resilience.ConnectionResilience;
import org.fireflyframework.apiflow.rest.ExecutionController;
import org.fireflyframework.apiflow.runner.HttpStepRunner;
import org.fireflyframework.apiflow.runner.StepRunner;
import org.fireflyframework.apiflow.store.ExecutionStore;
import org.fireflyframework.apiflow.store.InMemoryExecutionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import reactor.core.publisher.Mono;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ApiFlowAutoConfiguration} bean wiring.
 */
class ApiFlowAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ApiFlowAutoConfiguration.class));

    private static CredentialResolver noConnections() {
        return connectionRef -> Mono.error(new CredentialUnavailableException(connectionRef, "no connections"));
    }

    @Test
    @DisplayName("should create submission and control beans without a credential resolver")
    void createsControlPlaneOnly() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ExecutionStore.class);
            assertThat(context.getBean(ExecutionStore.class)).isInstanceOf(InMemoryExecutionStore.class);
            assertThat(context).hasSingleBean(ExecutionQueue.class);
            assertThat(context).hasSingleBean(ExecutionSubmitter.class);
            assertThat(context).hasSingleBean(ExecutionControlService.class);
            assertThat(context).hasSingleBean(ExecutionRecoveryService.class);
            assertThat(context).hasSingleBean(ExecutionController.class);
            assertThat(context).hasSingleBean(ApiFlowHealthIndicator.class);
            assertThat(context).doesNotHaveBean(StepRunner.class);
            assertThat(context).doesNotHaveBean(ExecutionCoordinator.class);
            assertThat(context).doesNotHaveBean(ExecutionWorker.class);
            assertThat(context).doesNotHaveBean(ExecutionMetrics.class);
        });
    }

    @Test
    @DisplayName("should start a worker once a credential resolver is provided")
    void createsWorker() {
        contextRunner
                .withBean(CredentialResolver.class, ApiFlowAutoConfigurationTest::noConnections)
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("firefly.apiflow.queue.concurrency=2")
                .run(context -> {
                    assertThat(context).hasSingleBean(ConnectionResilience.class);
                    assertThat(context.getBean(StepRunner.class)).isInstanceOf(HttpStepRunner.class);
                    assertThat(context).hasSingleBean(ExecutionCoordinator.class);
                    assertThat(context).hasSingleBean(ExecutionMetrics.class);
                    assertThat(context.getBean(ExecutionWorker.class).isRunning()).isTrue();
                });
    }

    @Test
    @DisplayName("should not start consuming when the consumer is disabled")
    void consumerDisabled() {
        contextRunner
                .withBean(CredentialResolver.class, ApiFlowAutoConfigurationTest::noConnections)
                .withPropertyValues("firefly.apiflow.queue.consumer-enabled=false")
                .run(context -> {
                    assertThat(context).hasSingleBean(ExecutionCoordinator.class);
                    assertThat(context).doesNotHaveBean(ExecutionWorker.class);
                });
    }

    @Test
    @DisplayName("should back off when disabled")
    void disabled() {
        contextRunner
                .withPropertyValues("firefly.apiflow.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ExecutionStore.class);
                    assertThat(context).doesNotHaveBean(ExecutionSubmitter.class);
                });
    }

    @Test
    @DisplayName("should bind engine properties")
    void bindsProperties() {
        contextRunner
                .withPropertyValues(
                        "firefly.apiflow.default-step-timeout=PT45S",
                        "firefly.apiflow.retry.max-attempts=5",
                        "firefly.apiflow.retry.base-delay=PT2S",
                        "firefly.apiflow.queue.name=orders-flow",
                        "firefly.apiflow.queue.visibility-timeout=PT90S",
                        "firefly.apiflow.recovery.enabled=false",
                        "firefly.apiflow.api.enabled=false")
                .run(context -> {
                    ApiFlowProperties properties = context.getBean(ApiFlowProperties.class);
                    assertThat(properties.getDefaultStepTimeout()).isEqualTo(Duration.ofSeconds(45));
                    assertThat(properties.getRetry().getMaxAttempts()).isEqualTo(5);
                    assertThat(properties.getRetry().getBaseDelay()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(context.getBean(ExecutionQueue.class).getQueueName()).isEqualTo("orders-flow");
                    assertThat(properties.getQueue().effectiveHeartbeatInterval()).isEqualTo(Duration.ofSeconds(30));
                    assertThat(context).doesNotHaveBean(ExecutionRecoveryService.class);
                    assertThat(context).doesNotHaveBean(ExecutionController.class);
                });
    }

    @Test
    @DisplayName("should keep an application-defined store")
    void customStore() {
        InMemoryExecutionStore custom = new InMemoryExecutionStore();
        contextRunner
                .withBean(ExecutionStore.class, () -> custom)
                .run(context -> assertThat(context.getBean(ExecutionStore.class)).isSameAs(custom));
    }
}
