package me.golemcore.warden.security;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.warden.domain.exception.SchemaException;
import me.golemcore.warden.domain.model.ToolCall;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Validates parsed tool arguments against the subset of JSON Schema tools use
 * for their input: {@code type}, {@code properties}, {@code required},
 * {@code enum}, {@code items} and {@code additionalProperties: false}.
 */
@Component
public class ArgumentSchemaValidator {

    private static final String TYPE = "type";

    /**
     * @throws SchemaException
     *             if the arguments were not a JSON object or violate the schema
     */
    public void validate(ToolCall call, Map<String, Object> schema) {
        if (!call.hasParsedArguments()) {
            throw new SchemaException(List.of("arguments are not a valid JSON object"));
        }
        if (schema == null || schema.isEmpty()) {
            return;
        }
        List<String> errors = new ArrayList<>();
        validateValue("$", call.getArguments(), schema, errors);
        if (!errors.isEmpty()) {
            throw new SchemaException(errors);
        }
    }

    @SuppressWarnings("unchecked")
    private void validateValue(String path, Object value, Map<String, Object> schema, List<String> errors) {
        Object type = schema.get(TYPE);
        if (type instanceof String expectedType && !matchesType(expectedType, value)) {
            errors.add(path + ": expected " + expectedType + " but was " + describe(value));
            return;
        }

        Object allowed = schema.get("enum");
        if (allowed instanceof Collection<?> options && !options.contains(value)) {
            errors.add(path + ": value " + value + " is not one of " + options);
        }

        if (value instanceof Map<?, ?> object) {
            validateObject(path, (Map<String, Object>) object, schema, errors);
        } else if (value instanceof List<?> list && schema.get("items") instanceof Map<?, ?> items) {
            for (int i = 0; i < list.size(); i++) {
                validateValue(path + "[" + i + "]", list.get(i), (Map<String, Object>) items, errors);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void validateObject(String path, Map<String, Object> object, Map<String, Object> schema,
            List<String> errors) {
        Map<String, Object> properties = schema.get("properties") instanceof Map<?, ?> props
                ? (Map<String, Object>) props
                : Map.of();

        if (schema.get("required") instanceof Collection<?> required) {
            for (Object name : required) {
                if (!object.containsKey(String.valueOf(name)) || object.get(String.valueOf(name)) == null) {
                    errors.add(path + ": missing required property '" + name + "'");
                }
            }
        }

        for (Map.Entry<String, Object> entry : object.entrySet()) {
            Object propertySchema = properties.get(entry.getKey());
            if (propertySchema instanceof Map<?, ?> nested) {
                if (entry.getValue() != null) {
                    validateValue(path + "." + entry.getKey(), entry.getValue(), (Map<String, Object>) nested,
                            errors);
                }
            } else if (Boolean.FALSE.equals(schema.get("additionalProperties"))) {
                errors.add(path + ": unexpected property '" + entry.getKey() + "'");
            }
        }
    }

    private boolean matchesType(String expectedType, Object value) {
        return switch (expectedType) {
        case "object" -> value instanceof Map<?, ?>;
        case "array" -> value instanceof List<?>;
        case "string" -> value instanceof String;
        case "boolean" -> value instanceof Boolean;
        case "integer" -> value instanceof Integer || value instanceof Long
                || value instanceof java.math.BigInteger;
        case "number" -> value instanceof Number;
        case "null" -> value == null;
        default -> true;
        };
    }

    private String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map<?, ?>) {
            return "object";
        }
        if (value instanceof List<?>) {
            return "array";
        }
        return value.getClass().getSimpleName().toLowerCase(java.util.Locale.ROOT);
    }
}
