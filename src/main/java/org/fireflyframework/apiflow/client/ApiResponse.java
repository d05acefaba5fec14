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

import java.util.Map;

/**
 * Response of an API connection call.
 *
 * @param statusCode HTTP status code
 * @param body parsed JSON body, raw text when the body is not JSON, null when empty
 * @param headers response headers, first value per name
 */
public record ApiResponse(int statusCode, Object body, Map<String, String> headers) {

    public ApiResponse {
        if (headers == null) {
            headers = Map.of();
        }
    }

    public static ApiResponse of(int statusCode, Object body) {
        return new ApiResponse(statusCode, body, Map.of());
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
