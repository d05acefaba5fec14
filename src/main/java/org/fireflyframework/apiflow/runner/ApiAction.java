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

import org.fireflyframework.apiflow.exception.NonRetryableStepException;
import org.springframework.http.HttpMethod;

import java.util.Locale;
import java.util.Set;

/**
 * Parsed form of a step action such as {@code "POST /users/{{param.id}}/orders"}.
 */
public record ApiAction(HttpMethod method, String path) {

    private static final Set<HttpMethod> SUPPORTED = Set.of(
            HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE, HttpMethod.PATCH);

    /**
     * Parses an action string.
     *
     * @param action the action, method and path separated by whitespace
     * @return the parsed action
     * @throws NonRetryableStepException if the action is malformed
     */
    public static ApiAction parse(String action) {
        if (action == null || action.isBlank()) {
            throw new NonRetryableStepException("Step action is empty");
        }
        String[] parts = action.trim().split("\\s+", 2);
        if (parts.length != 2 || !parts[1].startsWith("/")) {
            throw new NonRetryableStepException("Invalid step action '" + action + "', expected 'METHOD /path'");
        }
        HttpMethod method = HttpMethod.valueOf(parts[0].toUpperCase(Locale.ROOT));
        if (!SUPPORTED.contains(method)) {
            throw new NonRetryableStepException("Unsupported HTTP method in step action: " + parts[0]);
        }
        return new ApiAction(method, parts[1]);
    }
}
