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

import org.fireflyframework.apiflow.model.ExecutionContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes {@code {{reference}}} placeholders in step parameters and paths.
 * <p>
 * A value that is exactly one placeholder takes the referenced value with its
 * type. Placeholders embedded in longer text are replaced by the value's string
 * form. Unresolved references become null, or an empty string inside text.
 */
public class ParameterResolver {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([^{}]+?)\\s*}}");

    public Map<String, Object> resolve(Map<String, Object> parameters, ExecutionContext context) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        parameters.forEach((key, value) -> resolved.put(key, resolveValue(value, context)));
        return resolved;
    }

    public String resolveText(String text, ExecutionContext context) {
        if (text == null || !text.contains("{{")) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object value = context.lookup(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? String.valueOf(value) : ""));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private Object resolveValue(Object value, ExecutionContext context) {
        if (value instanceof String text) {
            Matcher matcher = PLACEHOLDER.matcher(text);
            if (matcher.matches()) {
                return context.lookup(matcher.group(1));
            }
            return resolveText(text, context);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((k, v) -> nested.put(String.valueOf(k), resolveValue(v, context)));
            return nested;
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            list.forEach(item -> items.add(resolveValue(item, context)));
            return items;
        }
        return value;
    }
}
