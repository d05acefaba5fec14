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

package org.fireflyframework.apiflow.client;

import reactor.core.publisher.Mono;

/**
 * Turns a step's connection reference into an authenticated client.
 * <p>
 * Implementations live outside the engine (they own secrets and connection
 * configuration). A connection that cannot be resolved must be reported as
 * {@link org.fireflyframework.apiflow.exception.CredentialUnavailableException};
 * the step then fails without retry.
 */
@FunctionalInterface
public interface CredentialResolver {

    /**
     * Resolves a connection.
     *
     * @param connectionRef the reference stored on the step
     * @return the client, or an error
     */
    Mono<AuthenticatedClient> resolve(String connectionRef);
}
