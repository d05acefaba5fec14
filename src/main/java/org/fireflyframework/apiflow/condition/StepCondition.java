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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Predicate deciding whether a step runs. Conditions are plain data; they are
 * evaluated by {@link ConditionEvaluator} without side effects.
 * <p>
 * JSON form uses a {@code type} discriminator, e.g.
 * <pre>
 * {"type": "all", "conditions": [
 *   {"type": "field", "field": "step.1.status", "operator": "equals", "value": "active"},
 *   {"type": "expression", "expression": "#params['amount'] &gt; 100"}
 * ]}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FieldCondition.class, name = "field"),
        @JsonSubTypes.Type(value = AllOfCondition.class, name = "all"),
        @JsonSubTypes.Type(value = AnyOfCondition.class, name = "any"),
        @JsonSubTypes.Type(value = NotCondition.class, name = "not"),
        @JsonSubTypes.Type(value = ExpressionCondition.class, name = "expression")
})
public interface StepCondition {
}
