package com.example.docstandards.compliance.rule;

import com.example.docstandards.standard.model.RuleDefinition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to rule parameters. Parameters round-trip through MongoDB, so lists
 * and maps arrive as whatever collection type the driver chose.
 */
final class RuleParams {

    private RuleParams() {}

    static String string(RuleDefinition rule, String name) {
        Object value = rule.params().get(name);
        if (value == null) {
            throw new IllegalArgumentException("Rule " + rule.id() + " is missing parameter '" + name + "'");
        }
        return value.toString();
    }

    static List<String> stringList(RuleDefinition rule, String name) {
        Object value = rule.params().get(name);
        if (!(value instanceof Collection<?> collection)) {
            throw new IllegalArgumentException("Rule " + rule.id() + " parameter '" + name + "' must be a list");
        }
        List<String> result = new ArrayList<>(collection.size());
        for (Object item : collection) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    static Map<String, String> stringMap(RuleDefinition rule, String name) {
        return toStringMap(rule, name, rule.params().get(name));
    }

    static Map<String, Map<String, String>> nestedStringMap(RuleDefinition rule, String name) {
        Object value = rule.params().get(name);
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Rule " + rule.id() + " parameter '" + name + "' must be a map");
        }
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        map.forEach((key, inner) -> result.put(String.valueOf(key), toStringMap(rule, name, inner)));
        return result;
    }

    private static Map<String, String> toStringMap(RuleDefinition rule, String name, Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("Rule " + rule.id() + " parameter '" + name + "' must be a map");
        }
        Map<String, String> result = new LinkedHashMap<>();
        map.forEach((key, inner) -> result.put(String.valueOf(key), String.valueOf(inner)));
        return result;
    }
}
