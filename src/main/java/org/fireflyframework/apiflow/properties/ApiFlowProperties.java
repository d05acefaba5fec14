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

package org.fireflyframework.apiflow.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.fireflyframework.apiflow.retry.BackoffSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the API flow engine.
 */
@ConfigurationProperties(prefix = "firefly.apiflow")
@Validated
@Data
public class ApiFlowProperties {

    /**
     * Whether the engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Timeout applied to steps that do not declare their own.
     */
    @NotNull
    private Duration defaultStepTimeout = Duration.ofMinutes(5);

    /**
     * Whether to enable metrics collection.
     */
    private boolean metricsEnabled = true;

    /**
     * Whether to enable health checks.
     */
    private boolean healthEnabled = true;

    /**
     * Retry configuration.
     */
    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    /**
     * Execution queue configuration.
     */
    @Valid
    @NotNull
    private QueueConfig queue = new QueueConfig();

    /**
     * Control API configuration.
     */
    @Valid
    @NotNull
    private ControlConfig control = new ControlConfig();

    /**
     * Stale execution recovery configuration.
     */
    @Valid
    @NotNull
    private RecoveryConfig recovery = new RecoveryConfig();

    /**
     * REST API configuration.
     */
    @Valid
    @NotNull
    private ApiConfig api = new ApiConfig();

    /**
     * Resilience configuration for calls to API connections.
     */
    @Valid
    @NotNull
    private ResilienceConfig resilience = new ResilienceConfig();

    /**
     * Retry configuration.
     */
    @Data
    public static class RetryConfig {

        /**
         * Attempts allowed per step, including the first one.
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Delay before the first retry.
         */
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(5);

        /**
         * Maximum delay between retries.
         */
        @NotNull
        private Duration maxDelay = Duration.ofMinutes(5);

        /**
         * Multiplier for exponential backoff.
         */
        @DecimalMin("1.0")
        private double multiplier = 2.0;

        /**
         * Maximum relative jitter applied to each delay.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.2;

        public BackoffSettings toBackoffSettings() {
            return new BackoffSettings(baseDelay, maxDelay, multiplier, jitterFactor);
        }
    }

    /**
     * Execution queue configuration.
     */
    @Data
    public static class QueueConfig {

        /**
         * Name of the queue execution jobs are placed on.
         */
        @NotBlank
        private String name = "workflow-execution";

        /**
         * Maximum number of deliveries processed concurrently by this node.
         */
        @Min(1)
        private int concurrency = 10;

        /**
         * How often the in-memory queue looks for due jobs.
         */
        @NotNull
        private Duration pollInterval = Duration.ofMillis(200);

        /**
         * Time after which an unacknowledged delivery becomes visible again.
         */
        @NotNull
        private Duration visibilityTimeout = Duration.ofMinutes(10);

        /**
         * How often a worker extends the visibility of the job it is working on.
         * Defaults to a third of the visibility timeout.
         */
        private Duration heartbeatInterval;

        /**
         * Whether this node consumes execution jobs. Nodes that only submit and control
         * executions can turn this off.
         */
        private boolean consumerEnabled = true;

        public Duration effectiveHeartbeatInterval() {
            return heartbeatInterval != null ? heartbeatInterval : visibilityTimeout.dividedBy(3);
        }
    }

    /**
     * Control API configuration.
     */
    @Data
    public static class ControlConfig {

        /**
         * Attempts at applying a control action when the execution changes concurrently.
         */
        @Min(1)
        private int maxUpdateAttempts = 3;
    }

    /**
     * Recovery configuration.
     */
    @Data
    public static class RecoveryConfig {

        /**
         * Whether stale executions are re-enqueued.
         */
        private boolean enabled = true;

        /**
         * Executions not updated for this long are considered stale.
         */
        @NotNull
        private Duration staleThreshold = Duration.ofMinutes(30);

        /**
         * Interval between periodic scans.
         */
        @NotNull
        private Duration scanInterval = Duration.ofMinutes(5);
    }

    /**
     * REST API configuration.
     */
    @Data
    public static class ApiConfig {

        /**
         * Whether to enable the REST API.
         */
        private boolean enabled = true;

        /**
         * Base path for the REST endpoints.
         */
        private String basePath = "/api/v1/apiflow";
    }

    /**
     * Resilience configuration for Circuit Breaker, Rate Limiter and Bulkhead.
     */
    @Data
    public static class ResilienceConfig {

        /**
         * Whether resilience features are enabled.
         */
        private boolean enabled = true;

        @Valid
        @NotNull
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

        @Valid
        @NotNull
        private RateLimiterConfig rateLimiter = new RateLimiterConfig();

        @Valid
        @NotNull
        private BulkheadConfig bulkhead = new BulkheadConfig();
    }

    /**
     * Circuit breaker configuration, one breaker per connection.
     */
    @Data
    public static class CircuitBreakerConfig {

        private boolean enabled = true;

        /**
         * Failure rate threshold percentage (0-100) to open the circuit.
         */
        @Min(1)
        private int failureRateThreshold = 50;

        /**
         * Minimum number of calls before calculating failure rate.
         */
        @Min(1)
        private int minimumNumberOfCalls = 10;

        /**
         * Sliding window size in calls.
         */
        @Min(1)
        private int slidingWindowSize = 100;

        /**
         * Wait duration in open state before transitioning to half-open.
         */
        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(60);

        /**
         * Number of permitted calls in half-open state.
         */
        @Min(1)
        private int permittedNumberOfCallsInHalfOpenState = 10;
    }

    /**
     * Rate limiter configuration, one limiter per connection.
     */
    @Data
    public static class RateLimiterConfig {

        private boolean enabled = false;

        /**
         * Number of permissions available during one limit refresh period.
         */
        @Min(1)
        private int limitForPeriod = 50;

        /**
         * Period of a limit refresh.
         */
        @NotNull
        private Duration limitRefreshPeriod = Duration.ofSeconds(1);

        /**
         * Maximum time a call waits for permission.
         */
        @NotNull
        private Duration timeoutDuration = Duration.ofSeconds(5);
    }

    /**
     * Bulkhead configuration, one bulkhead per connection.
     */
    @Data
    public static class BulkheadConfig {

        private boolean enabled = false;

        /**
         * Maximum number of concurrent calls.
         */
        @Min(1)
        private int maxConcurrentCalls = 25;

        /**
         * Maximum wait duration for a permit.
         */
        @NotNull
        private Duration maxWaitDuration = Duration.ofMillis(0);
    }
}
