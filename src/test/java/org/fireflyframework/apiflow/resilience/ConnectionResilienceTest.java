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

package org.fireflyframework.apiflow.resilience;

import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.fireflyframework.apiflow.exception.NonRetryableStepException;
import org.fireflyframework.apiflow.exception.RetryableStepException;
import org.fireflyframework.apiflow.properties.ApiFlowProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ConnectionResilience.
 */
class ConnectionResilienceTest {

    private ApiFlowProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ApiFlowProperties();
        ApiFlowProperties.CircuitBreakerConfig circuitBreaker = properties.getResilience().getCircuitBreaker();
        circuitBreaker.setMinimumNumberOfCalls(2);
        circuitBreaker.setSlidingWindowSize(2);
        circuitBreaker.setFailureRateThreshold(50);
        circuitBreaker.setWaitDurationInOpenState(Duration.ofMinutes(1));
    }

    @Test
    void shouldPassThroughWhenDisabled() {
        properties.getResilience().setEnabled(false);
        ConnectionResilience resilience = new ConnectionResilience(properties);

        StepVerifier.create(resilience.decorate("crm", Mono.just("ok")))
                .expectNext("ok")
                .verifyComplete();

        assertThat(resilience.circuitBreakerState("crm")).isNull();
    }

    @Test
    void shouldOpenCircuitPerConnectionAfterFailures() {
        ConnectionResilience resilience = new ConnectionResilience(properties);

        for (int i = 0; i < 2; i++) {
            StepVerifier.create(resilience.decorate("crm", Mono.error(new RetryableStepException(503, "HTTP 503"))))
                    .expectError(RetryableStepException.class)
                    .verify();
        }

        assertThat(resilience.circuitBreakerState("crm")).isEqualTo(CircuitBreaker.State.OPEN);
        StepVerifier.create(resilience.decorate("crm", Mono.just("ok")))
                .expectError(CallNotPermittedException.class)
                .verify();

        // other connections are unaffected
        StepVerifier.create(resilience.decorate("billing", Mono.just("ok")))
                .expectNext("ok")
                .verifyComplete();
    }

    @Test
    void shouldNotCountPermanentFailuresAgainstCircuit() {
        ConnectionResilience resilience = new ConnectionResilience(properties);

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(resilience.decorate("crm", Mono.error(new NonRetryableStepException(404, "HTTP 404"))))
                    .expectError(NonRetryableStepException.class)
                    .verify();
        }

        assertThat(resilience.circuitBreakerState("crm")).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void shouldResetCircuit() {
        ConnectionResilience resilience = new ConnectionResilience(properties);
        resilience.circuitBreakerFor("crm").transitionToOpenState();

        resilience.resetCircuitBreaker("crm");

        assertThat(resilience.circuitBreakerStates()).containsEntry("crm", CircuitBreaker.State.CLOSED);
    }

    @Test
    void shouldRejectWhenBulkheadIsFull() {
        properties.getResilience().getCircuitBreaker().setEnabled(false);
        properties.getResilience().getBulkhead().setEnabled(true);
        properties.getResilience().getBulkhead().setMaxConcurrentCalls(1);
        ConnectionResilience resilience = new ConnectionResilience(properties);

        resilience.decorate("crm", Mono.never()).subscribe();

        StepVerifier.create(resilience.decorate("crm", Mono.just("ok")))
                .expectError(BulkheadFullException.class)
                .verify();
    }
}
