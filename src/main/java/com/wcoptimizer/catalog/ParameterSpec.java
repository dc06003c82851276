package com.wcoptimizer.catalog;

/**
 * One declared argument of a named analysis.
 */
public record ParameterSpec(String name, Type type, boolean required, Object defaultValue, String description) {

    public enum Type {
        INTEGER, NUMBER, STRING, STRING_ARRAY;

        public String jsonType() {
            return switch (this) {
                case INTEGER -> "integer";
                case NUMBER -> "number";
                case STRING -> "string";
                case STRING_ARRAY -> "array";
            };
        }
    }

    public static ParameterSpec optional(String name, Type type, Object defaultValue, String description) {
        return new ParameterSpec(name, type, false, defaultValue, description);
    }

    public static ParameterSpec required(String name, Type type, String description) {
        return new ParameterSpec(name, type, true, null, description);
    }
}
