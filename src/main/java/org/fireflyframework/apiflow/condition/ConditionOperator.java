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

package org.fireflyframework.apiflow.condition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Comparison applied by a {@link FieldCondition}.
 */
public enum ConditionOperator {
    @JsonProperty("equals")
    EQUALS,
    @JsonProperty("not_equals")
    NOT_EQUALS,
    @JsonProperty("greater_than")
    GREATER_THAN,
    @JsonProperty("less_than")
    LESS_THAN,
    @JsonProperty("contains")
    CONTAINS,
    @JsonProperty("exists")
    EXISTS,
    @JsonProperty("not_exists")
    NOT_EXISTS
}
