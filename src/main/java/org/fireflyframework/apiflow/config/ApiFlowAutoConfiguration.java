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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.client.CredentialResolver;
import org.fireflyframework.apiflow.condition.ConditionEvaluator;
import org.fireflyframework.apiflow.control.ExecutionControlService;
import org.fireflyframework.apiflow.core.ExecutionCoordinator;
import org.fireflyframework.apiflow.core.ExecutionSubmitter;
import org.fireflyframework.apiflow.core.ExecutionWorker;
import org.fireflyframework.apiflow.health.ApiFlowHealthIndicator;
import org.fireflyframework.apiflow.metrics.ExecutionMetrics;
import org.fireflyframework.apiflow.properties.ApiFlowProperties;
import org.fireflyframework.apiflow.queue.ExecutionQueue;
import org.fireflyframework.apiflow.queue.InMemoryExecutionQueue;
import org.fireflyframework.apiflow.recovery.ExecutionRecoveryService;
import org.fireflyframework.apiflow.resilience.ConnectionResilience;
import org.fireflyframework.apiflow.rest.ExecutionController;
import org.fireflyframework.apiflow.retry.RetryBackoffPolicy;
import org.fireflyframework.apiflow.runner.HttpStepRunner;
import org.fireflyframework.apiflow.runner.ParameterResolver;
import org.fireflyframework.apiflow.runner.StepErrorClassifier;
import org.fireflyframework.apiflow.runner.StepRunner;
import org.fireflyframework.apiflow.store.ExecutionStore;
import org.fireflyframework.apiflow.store.InMemoryExecutionStore;
import org.fireflyframework.apiflow.store.JsonColumnCodec;
import org.fireflyframework.apiflow.store.R2dbcExecutionStore;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.lang.Nullable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import java.time.Clock;

/**
 * Auto-configuration for the Firefly API flow engine.
 * <p>
 * This configuration provides all beans needed to run workflow executions:
 * <ul>
 *   <li>ExecutionStore - R2DBC when a DatabaseClient is available, in-memory otherwise</li>
 *   <li>ExecutionQueue - in-process queue with delayed delivery and visibility timeout</li>
 *   <li>StepRunner - HTTP step runner, created when the application provides a CredentialResolver</li>
 *   <li>ExecutionCoordinator and ExecutionWorker - drive executions from queue deliveries</li>
 *   <li>ExecutionSubmitter and ExecutionControlService - submission and pause/resume/cancel</li>
 *   <li>ExecutionRecoveryService - re-enqueues executions whose job was lost</li>
 *   <li>ExecutionController - REST API endpoints</li>
 *   <li>ApiFlowHealthIndicator and ExecutionMetrics - monitoring</li>
 * </ul>
 * Every bean backs off when the application defines its own.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.r2dbc.R2dbcDataAutoConfiguration",
        "org.springframework.boot.autoconfigure.r2dbc.R2dbcTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
})
@EnableConfigurationProperties(ApiFlowProperties.class)
@ConditionalOnProperty(prefix = "firefly.apiflow", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ApiFlowAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock apiFlowClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonColumnCodec jsonColumnCodec(@Nullable ObjectMapper objectMapper) {
        ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("Creating JsonColumnCodec (application ObjectMapper: {})", objectMapper != null);
        return new JsonColumnCodec(mapper);
    }

    // ==================== Persistence and queue ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    public ExecutionStore r2dbcExecutionStore(DatabaseClient databaseClient,
                                              JsonColumnCodec jsonColumnCodec,
                                              @Nullable TransactionalOperator transactionalOperator) {
        log.info("Creating R2dbcExecutionStore (transactional workflow writes: {})", transactionalOperator != null);
        return new R2dbcExecutionStore(databaseClient, jsonColumnCodec, transactionalOperator);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionStore inMemoryExecutionStore() {
        log.warn("Creating InMemoryExecutionStore: executions will not survive a restart");
        return new InMemoryExecutionStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionQueue executionQueue(ApiFlowProperties properties, Clock apiFlowClock) {
        ApiFlowProperties.QueueConfig queue = properties.getQueue();
        log.info("Creating InMemoryExecutionQueue: name={}, pollInterval={}, visibilityTimeout={}",
                queue.getName(), queue.getPollInterval(), queue.getVisibilityTimeout());
        return InMemoryExecutionQueue.builder()
                .queueName(queue.getName())
                .pollInterval(queue.getPollInterval())
                .visibilityTimeout(queue.getVisibilityTimeout())
                .clock(apiFlowClock)
                .build();
    }

    // ==================== Step execution ====================

    @Bean
    @ConditionalOnMissingBean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryBackoffPolicy retryBackoffPolicy(ApiFlowProperties properties) {
        ApiFlowProperties.RetryConfig retry = properties.getRetry();
        log.info("Creating RetryBackoffPolicy: maxAttempts={}, baseDelay={}, maxDelay={}, jitterFactor={}",
                retry.getMaxAttempts(), retry.getBaseDelay(), retry.getMaxDelay(), retry.getJitterFactor());
        return new RetryBackoffPolicy(retry.toBackoffSettings());
    }

    @Bean
    @ConditionalOnMissingBean
    public ParameterResolver parameterResolver() {
        return new ParameterResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public StepErrorClassifier stepErrorClassifier() {
        return new StepErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.apiflow.resilience", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ConnectionResilience connectionResilience(ApiFlowProperties properties) {
        log.info("Creating ConnectionResilience with circuit breaker: {}, rate limiter: {}, bulkhead: {}",
                properties.getResilience().getCircuitBreaker().isEnabled(),
                properties.getResilience().getRateLimiter().isEnabled(),
                properties.getResilience().getBulkhead().isEnabled());
        return new ConnectionResilience(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(CredentialResolver.class)
    public StepRunner stepRunner(CredentialResolver credentialResolver,
                                 ParameterResolver parameterResolver,
                                 StepErrorClassifier stepErrorClassifier,
                                 @Nullable ConnectionResilience connectionResilience) {
        log.info("Creating HttpStepRunner (resilience: {})", connectionResilience != null);
        return new HttpStepRunner(credentialResolver, parameterResolver, stepErrorClassifier, connectionResilience);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.apiflow", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionMetrics executionMetrics(MeterRegistry meterRegistry) {
        log.info("Creating ExecutionMetrics");
        return new ExecutionMetrics(meterRegistry);
    }

    // ==================== Coordination ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(StepRunner.class)
    public ExecutionCoordinator executionCoordinator(ExecutionStore executionStore,
                                                     StepRunner stepRunner,
                                                     ConditionEvaluator conditionEvaluator,
                                                     RetryBackoffPolicy retryBackoffPolicy,
                                                     ExecutionQueue executionQueue,
                                                     @Nullable ExecutionMetrics executionMetrics,
                                                     ApiFlowProperties properties,
                                                     Clock apiFlowClock) {
        log.info("Creating ExecutionCoordinator with defaultStepTimeout: {}, metrics: {}",
                properties.getDefaultStepTimeout(), executionMetrics != null);
        return new ExecutionCoordinator(executionStore, stepRunner, conditionEvaluator, retryBackoffPolicy,
                executionQueue, executionMetrics, properties.getDefaultStepTimeout(), apiFlowClock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(ExecutionCoordinator.class)
    @ConditionalOnProperty(prefix = "firefly.apiflow.queue", name = "consumer-enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionWorker executionWorker(ExecutionQueue executionQueue,
                                           ExecutionCoordinator executionCoordinator,
                                           ApiFlowProperties properties) {
        ApiFlowProperties.QueueConfig queue = properties.getQueue();
        ExecutionWorker worker = new ExecutionWorker(executionQueue, executionCoordinator,
                queue.getConcurrency(), queue.effectiveHeartbeatInterval());
        worker.start();
        log.info("Created and started ExecutionWorker with concurrency={}, heartbeatInterval={}",
                queue.getConcurrency(), queue.effectiveHeartbeatInterval());
        return worker;
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionSubmitter executionSubmitter(ExecutionStore executionStore,
                                                 ExecutionQueue executionQueue,
                                                 ApiFlowProperties properties,
                                                 Clock apiFlowClock) {
        log.info("Creating ExecutionSubmitter with default maxAttempts: {}", properties.getRetry().getMaxAttempts());
        return new ExecutionSubmitter(executionStore, executionQueue, properties.getRetry().getMaxAttempts(), apiFlowClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionControlService executionControlService(ExecutionStore executionStore,
                                                           ExecutionQueue executionQueue,
                                                           @Nullable ExecutionMetrics executionMetrics,
                                                           ApiFlowProperties properties,
                                                           Clock apiFlowClock) {
        log.info("Creating ExecutionControlService with maxUpdateAttempts: {}",
                properties.getControl().getMaxUpdateAttempts());
        return new ExecutionControlService(executionStore, executionQueue, executionMetrics,
                properties.getControl().getMaxUpdateAttempts(), apiFlowClock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.apiflow.recovery", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionRecoveryService executionRecoveryService(ExecutionStore executionStore,
                                                             ExecutionQueue executionQueue,
                                                             @Nullable ExecutionMetrics executionMetrics,
                                                             ApiFlowProperties properties,
                                                             Clock apiFlowClock) {
        ApiFlowProperties.RecoveryConfig recovery = properties.getRecovery();
        log.info("Creating ExecutionRecoveryService with staleThreshold: {}, scanInterval: {}",
                recovery.getStaleThreshold(), recovery.getScanInterval());
        return new ExecutionRecoveryService(executionStore, executionQueue, executionMetrics,
                recovery.isEnabled(), recovery.getStaleThreshold(), recovery.getScanInterval(), apiFlowClock);
    }

    // ==================== API and monitoring ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.apiflow.api", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ExecutionController executionController(ExecutionSubmitter executionSubmitter,
                                                   ExecutionControlService executionControlService) {
        log.info("Creating ExecutionController REST API");
        return new ExecutionController(executionSubmitter, executionControlService);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.apiflow", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    public ApiFlowHealthIndicator apiFlowHealthIndicator(ExecutionStore executionStore,
                                                         ExecutionQueue executionQueue,
                                                         @Nullable ExecutionWorker executionWorker) {
        log.info("Creating ApiFlowHealthIndicator");
        return new ApiFlowHealthIndicator(executionStore, executionQueue, executionWorker);
    }
}
