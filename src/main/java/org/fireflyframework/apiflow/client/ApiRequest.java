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

import org.springframework.http.HttpMethod;

import java.util.Map;
import java.util.Objects;

/**
 * A resolved call to an API connection.
 *
 * @param method HTTP method
 * @param path path relative to the connection's base URL
 * @param parameters query parameters for GET/DELETE, JSON body otherwise
 */
public record ApiRequest(HttpMethod method, String path, Map<String, Object> parameters) {

    public ApiRequest {
        Objects.requireNonNull(method, "method cannot be null");
        Objects.requireNonNull(path, "path cannot be null");
        if (parameters == null) {
            parameters = Map.of();
        }
    }

    /**
     * Whether the parameters travel in the query string.
     */
    public boolean usesQueryParameters() {
        return HttpMethod.GET.equals(method) || HttpMethod.DELETE.equals(method);
    }
}
