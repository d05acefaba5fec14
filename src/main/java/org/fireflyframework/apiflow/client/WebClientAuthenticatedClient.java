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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link AuthenticatedClient} backed by Spring's {@link WebClient}.
 * <p>
 * Credential resolvers build one per connection with the base URL and the
 * authentication headers of that connection:
 * <pre>
 * WebClientAuthenticatedClient.builder(WebClient.builder(), objectMapper)
 *         .baseUrl("https://api.example.com")
 *         .bearerToken(token)
 *         .build();
 * </pre>
 */
@Slf4j
public class WebClientAuthenticatedClient implements AuthenticatedClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientAuthenticatedClient(WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    public static Builder builder(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
        return new Builder(webClientBuilder, objectMapper);
    }

    @Override
    public Mono<ApiResponse> execute(ApiRequest request) {
        WebClient.RequestBodySpec spec = webClient.method(request.method())
                .uri(uriBuilder -> buildUri(uriBuilder, request));

        WebClient.RequestHeadersSpec<?> headersSpec = request.usesQueryParameters() || request.parameters().isEmpty()
                ? spec
                : spec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.parameters());

        return headersSpec
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(this::toApiResponse);
    }

    private URI buildUri(UriBuilder uriBuilder, ApiRequest request) {
        uriBuilder.path(request.path());
        if (request.usesQueryParameters()) {
            request.parameters().forEach((name, value) -> {
                if (value instanceof Collection<?> values) {
                    values.forEach(v -> uriBuilder.queryParam(name, v));
                } else if (value != null) {
                    uriBuilder.queryParam(name, value);
                }
            });
        }
        return uriBuilder.build();
    }

    private Mono<ApiResponse> toApiResponse(ClientResponse response) {
        Map<String, String> headers = new LinkedHashMap<>();
        response.headers().asHttpHeaders().forEach((name, values) -> {
            if (!values.isEmpty()) {
                headers.put(name, values.get(0));
            }
        });
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .map(this::parseBody)
                .map(body -> new ApiResponse(status, body, headers))
                .defaultIfEmpty(new ApiResponse(status, null, headers));
    }

    private Object parseBody(String text) {
        if (text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Response body is not JSON, keeping raw text: {}", e.getOriginalMessage());
            return text;
        }
    }

    /**
     * Builder for a connection-specific client.
     */
    public static class Builder {

        private final WebClient.Builder webClientBuilder;
        private final ObjectMapper objectMapper;

        Builder(WebClient.Builder webClientBuilder, ObjectMapper objectMapper) {
            this.webClientBuilder = webClientBuilder;
            this.objectMapper = objectMapper;
        }

        public Builder baseUrl(String baseUrl) {
            webClientBuilder.baseUrl(baseUrl);
            return this;
        }

        public Builder header(String name, String value) {
            webClientBuilder.defaultHeader(name, value);
            return this;
        }

        public Builder bearerToken(String token) {
            return header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }

        public Builder apiKey(String headerName, String apiKey) {
            return header(headerName, apiKey);
        }

        public Builder basicAuth(String username, String password) {
            webClientBuilder.defaultHeaders(h -> h.setBasicAuth(username, password));
            return this;
        }

        public WebClientAuthenticatedClient build() {
            return new WebClientAuthenticatedClient(webClientBuilder.build(), objectMapper);
        }
    }
}
