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

import java.util.Objects;

/**
 * Compares the value at a context reference ({@code step.N.x}, {@code param.x},
 * {@code global.x}) with a literal.
 */
public record FieldCondition(String field, ConditionOperator operator, Object value) implements StepCondition {

    public FieldCondition {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");
    }

    public static FieldCondition of(String field, ConditionOperator operator, Object value) {
        return new FieldCondition(field, operator, value);
    }
}
