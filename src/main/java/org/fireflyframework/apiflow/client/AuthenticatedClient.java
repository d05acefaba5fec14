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
 * HTTP client already carrying the credentials of one API connection.
 * <p>
 * Non-2xx responses are returned as {@link ApiResponse}s rather than errors;
 * the step runner classifies them.
 */
@FunctionalInterface
public interface AuthenticatedClient {

    Mono<ApiResponse> execute(ApiRequest request);
}
