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

package org.fireflyframework.apiflow.runner;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.client.ApiRequest;
import org.fireflyframework.apiflow.client.ApiResponse;
import org.fireflyframework.apiflow.client.CredentialResolver;
import org.fireflyframework.apiflow.exception.CredentialUnavailableException;
import org.fireflyframework.apiflow.model.ExecutionContext;
import org.fireflyframework.apiflow.model.StepError;
import org.fireflyframework.apiflow.model.WorkflowStep;
import org.fireflyframework.apiflow.resilience.ConnectionResilience;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Runs a step as an HTTP call through the connection's {@link org.fireflyframework.apiflow.client.AuthenticatedClient}.
 * <p>
 * The whole attempt (credential resolution included) is bounded by the step timeout
 * using Reactor's {@code timeout} operator, independently of any timeout the client applies.
 */
@Slf4j
public class HttpStepRunner implements StepRunner {

    private final CredentialResolver credentialResolver;
    private final ParameterResolver parameterResolver;
    private final StepErrorClassifier errorClassifier;
    @Nullable
    private final ConnectionResilience resilience;

    public HttpStepRunner(CredentialResolver credentialResolver,
                          ParameterResolver parameterResolver,
                          StepErrorClassifier errorClassifier,
                          @Nullable ConnectionResilience resilience) {
        this.credentialResolver = credentialResolver;
        this.parameterResolver = parameterResolver;
        this.errorClassifier = errorClassifier;
        this.resilience = resilience;
    }

    @Override
    public Mono<StepOutcome> run(WorkflowStep step, ExecutionContext context, Duration timeout) {
        return Mono.defer(() -> {
                    ApiAction action = ApiAction.parse(step.action());
                    ApiRequest request = new ApiRequest(
                            action.method(),
                            parameterResolver.resolveText(action.path(), context),
                            parameterResolver.resolve(step.parameters(), context));

                    log.debug("STEP_CALL: executionId={}, stepOrder={}, method={}, path={}, connection={}",
                            context.executionId(), step.stepOrder(), request.method(), request.path(),
                            step.connectionRef());

                    Mono<ApiResponse> call = credentialResolver.resolve(step.connectionRef())
                            .switchIfEmpty(Mono.error(() -> new CredentialUnavailableException(
                                    step.connectionRef(), "no client returned")))
                            .flatMap(client -> client.execute(request))
                            .flatMap(response -> response.isSuccessful()
                                    ? Mono.just(response)
                                    : Mono.error(errorClassifier.toException(response)))
                            .timeout(timeout);

                    if (resilience != null) {
                        // outer timeout also bounds rate limiter and bulkhead waits
                        call = resilience.decorate(step.connectionRef(), call).timeout(timeout);
                    }

                    return call.<StepOutcome>map(response ->
                            new StepOutcome.Succeeded(response.body(), response.statusCode()));
                })
                .onErrorResume(e -> {
                    StepError error = errorClassifier.classify(e, step, timeout);
                    log.debug("STEP_CALL_FAILED: executionId={}, stepOrder={}, type={}, retryable={}, error={}",
                            context.executionId(), step.stepOrder(), error.type(), error.retryable(),
                            error.message());
                    return Mono.just(new StepOutcome.Failed(error));
                });
    }
}
