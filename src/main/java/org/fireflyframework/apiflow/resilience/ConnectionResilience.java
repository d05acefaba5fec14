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

import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.exception.NonRetryableStepException;
import org.fireflyframework.apiflow.properties.ApiFlowProperties;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resilience4j decorators for calls to API connections.
 * <p>
 * Circuit breakers, rate limiters and bulkheads are keyed by connection reference,
 * so one failing API does not trip calls to the others. Permanent (non-retryable)
 * failures do not count against a circuit breaker.
 */
@Slf4j
public class ConnectionResilience {

    private static final String NO_CONNECTION = "default";

    private final ApiFlowProperties.ResilienceConfig config;
    private final CircuitBreakerRegistry breakers;
    private final RateLimiterRegistry limiters;
    private final BulkheadRegistry bulkheads;

    public ConnectionResilience(ApiFlowProperties properties) {
        this.config = properties.getResilience();
        this.breakers = breakerRegistry(config.getCircuitBreaker());
        this.limiters = limiterRegistry(config.getRateLimiter());
        this.bulkheads = bulkheadRegistry(config.getBulkhead());
        attachListeners();

        log.info("RESILIENCE_INIT: enabled={}, circuitBreaker={}, rateLimiter={}, bulkhead={}",
                config.isEnabled(),
                config.getCircuitBreaker().isEnabled(),
                config.getRateLimiter().isEnabled(),
                config.getBulkhead().isEnabled());
    }

    /**
     * Decorates a call to a connection with the enabled resilience patterns.
     * The circuit breaker wraps the rate limiter, which wraps the bulkhead.
     *
     * @param connectionRef the connection the call goes to, may be null
     * @param call the call
     * @param <T> the result type
     * @return the decorated call
     */
    public <T> Mono<T> decorate(String connectionRef, Mono<T> call) {
        if (!config.isEnabled()) {
            return call;
        }
        String key = connectionRef != null ? connectionRef : NO_CONNECTION;
        Mono<T> guarded = call;
        if (config.getBulkhead().isEnabled()) {
            guarded = guarded.transformDeferred(BulkheadOperator.of(bulkheads.bulkhead(key)));
        }
        if (config.getRateLimiter().isEnabled()) {
            guarded = guarded.transformDeferred(RateLimiterOperator.of(limiters.rateLimiter(key)));
        }
        if (config.getCircuitBreaker().isEnabled()) {
            guarded = guarded.transformDeferred(CircuitBreakerOperator.of(circuitBreakerFor(key)));
        }
        return guarded;
    }

    public CircuitBreaker circuitBreakerFor(String connectionRef) {
        return breakers.circuitBreaker(connectionRef);
    }

    /**
     * State of a connection's circuit breaker, or null while no call went to it.
     */
    public CircuitBreaker.State circuitBreakerState(String connectionRef) {
        return breakers.find(connectionRef).map(CircuitBreaker::getState).orElse(null);
    }

    public void resetCircuitBreaker(String connectionRef) {
        breakers.find(connectionRef).ifPresent(breaker -> {
            breaker.reset();
            log.info("CIRCUIT_BREAKER_RESET: connection={}", connectionRef);
        });
    }

    public Map<String, CircuitBreaker.State> circuitBreakerStates() {
        return breakers.getAllCircuitBreakers().stream()
                .collect(Collectors.toMap(CircuitBreaker::getName, CircuitBreaker::getState));
    }

    private void attachListeners() {
        breakers.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onStateTransition(event -> log.info("CIRCUIT_BREAKER_STATE: connection={}, transition={}",
                        event.getCircuitBreakerName(), event.getStateTransition()))
                .onError(event -> log.debug("CIRCUIT_BREAKER_ERROR: connection={}, error={}",
                        event.getCircuitBreakerName(), event.getThrowable().toString())));
        limiters.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onFailure(event -> log.warn("RATE_LIMITER_REJECTED: connection={}",
                        event.getRateLimiterName())));
        bulkheads.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onCallRejected(event -> log.warn("BULKHEAD_REJECTED: connection={}",
                        event.getBulkheadName())));
    }

    private static CircuitBreakerRegistry breakerRegistry(ApiFlowProperties.CircuitBreakerConfig settings) {
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getSlidingWindowSize())
                .minimumNumberOfCalls(settings.getMinimumNumberOfCalls())
                .failureRateThreshold(settings.getFailureRateThreshold())
                .waitDurationInOpenState(settings.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(settings.getPermittedNumberOfCallsInHalfOpenState())
                .ignoreExceptions(NonRetryableStepException.class)
                .build());
    }

    private static RateLimiterRegistry limiterRegistry(ApiFlowProperties.RateLimiterConfig settings) {
        return RateLimiterRegistry.of(RateLimiterConfig.custom()
                .limitForPeriod(settings.getLimitForPeriod())
                .limitRefreshPeriod(settings.getLimitRefreshPeriod())
                .timeoutDuration(settings.getTimeoutDuration())
                .build());
    }

    private static BulkheadRegistry bulkheadRegistry(ApiFlowProperties.BulkheadConfig settings) {
        return BulkheadRegistry.of(BulkheadConfig.custom()
                .maxConcurrentCalls(settings.getMaxConcurrentCalls())
                .maxWaitDuration(settings.getMaxWaitDuration())
                .build());
    }
}
