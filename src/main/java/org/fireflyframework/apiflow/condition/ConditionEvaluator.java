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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.apiflow.model.ExecutionContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates {@link StepCondition} trees against an {@link ExecutionContext}.
 */
@Slf4j
public class ConditionEvaluator {

    private final ExpressionParser expressionParser = new SpelExpressionParser();
    private final Map<String, Expression> expressionCache = new ConcurrentHashMap<>();

    /**
     * Evaluates a condition. A null condition always holds.
     *
     * @param condition the condition, may be null
     * @param context the accumulated context
     * @return true if the step should run
     * @throws ConditionEvaluationException if the condition is malformed
     */
    public boolean evaluate(StepCondition condition, ExecutionContext context) {
        if (condition == null) {
            return true;
        }
        if (condition instanceof FieldCondition field) {
            return compare(context.lookup(field.field()), field.operator(), field.value());
        }
        if (condition instanceof AllOfCondition all) {
            return all.conditions().stream().allMatch(c -> evaluate(c, context));
        }
        if (condition instanceof AnyOfCondition any) {
            return any.conditions().stream().anyMatch(c -> evaluate(c, context));
        }
        if (condition instanceof NotCondition not) {
            return !evaluate(not.condition(), context);
        }
        if (condition instanceof ExpressionCondition expression) {
            return evaluateExpression(expression.expression(), context);
        }
        throw new ConditionEvaluationException("Unsupported condition type: " + condition.getClass().getName());
    }

    private boolean compare(Object actual, ConditionOperator operator, Object expected) {
        return switch (operator) {
            case EXISTS -> actual != null;
            case NOT_EXISTS -> actual == null;
            case EQUALS -> valueEquals(actual, expected);
            case NOT_EQUALS -> !valueEquals(actual, expected);
            case GREATER_THAN -> compareNumbers(actual, expected) > 0;
            case LESS_THAN -> compareNumbers(actual, expected) < 0;
            case CONTAINS -> contains(actual, expected);
        };
    }

    private boolean valueEquals(Object actual, Object expected) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (actual instanceof Number && expected instanceof Number && left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(actual, expected);
    }

    /**
     * Returns 0 when either side is not numeric, so neither greater_than nor less_than holds.
     */
    private int compareNumbers(Object actual, Object expected) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left == null || right == null) {
            return 0;
        }
        return left.compareTo(right);
    }

    private boolean contains(Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(element -> valueEquals(element, expected));
        }
        return String.valueOf(actual).contains(String.valueOf(expected));
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private boolean evaluateExpression(String expressionText, ExecutionContext context) {
        try {
            Expression expression = expressionCache.computeIfAbsent(expressionText, expressionParser::parseExpression);

            SimpleEvaluationContext evalContext = SimpleEvaluationContext.forReadOnlyDataBinding()
                    .withInstanceMethods()
                    .build();
            evalContext.setVariable("steps", context.stepOutputs());
            evalContext.setVariable("params", context.parameters());
            evalContext.setVariable("globals", context.globals());

            Boolean result = expression.getValue(evalContext, Boolean.class);
            return Boolean.TRUE.equals(result);
        } catch (ParseException | EvaluationException e) {
            log.warn("CONDITION_ERROR: executionId={}, expression={}, error={}",
                    context.executionId(), expressionText, e.getMessage());
            throw new ConditionEvaluationException("Invalid condition expression '" + expressionText + "': "
                    + e.getMessage(), e);
        }
    }
}
