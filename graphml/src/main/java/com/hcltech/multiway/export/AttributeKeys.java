package com.hcltech.multiway.export;

import java.util.LinkedHashMap;
import java.util.Map;

/** Attribute names in first-seen order with a GraphML type; a name seen with two types becomes a string. */
final class AttributeKeys {
    private final Map<String, String> types = new LinkedHashMap<>();

    void add(Map<String, Object> attributes) {
        attributes.forEach((name, value) -> types.merge(name, typeOf(value), (a, b) -> a.equals(b) ? a : "string"));
    }

    Map<String, String> types() {
        return types;
    }

    static String typeOf(Object value) {
        if (value instanceof Integer) return "int";
        if (value instanceof Long) return "long";
        if (value instanceof Double || value instanceof Float) return "double";
        if (value instanceof Boolean) return "boolean";
        return "string";
    }
}
