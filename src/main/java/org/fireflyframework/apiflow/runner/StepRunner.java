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

import org.fireflyframework.apiflow.model.ExecutionContext;
import org.fireflyframework.apiflow.model.WorkflowStep;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Executes a single step attempt.
 * <p>
 * Implementations enforce {@code timeout} themselves, never mutate shared state
 * and never signal an error: every failure is returned as {@link StepOutcome.Failed}.
 * Persisting the outcome is the coordinator's job.
 */
public interface StepRunner {

    Mono<StepOutcome> run(WorkflowStep step, ExecutionContext context, Duration timeout);
}
