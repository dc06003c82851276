package com.wcoptimizer.catalog;

import com.wcoptimizer.exception.InvalidParameterException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Caller-supplied arguments for one analysis, read through the analysis's declared
 * parameters so defaults and type checks live in one place. Keys the analysis
 * does not declare are ignored.
 */
public final class AnalysisArguments {

    private final Analysis analysis;
    private final Map<String, Object> values;

    public AnalysisArguments(Analysis analysis, Map<String, Object> values) {
        this.analysis = analysis;
        this.values = values == null ? Map.of() : values;
        for (ParameterSpec spec : analysis.getParameters()) {
            if (spec.required() && isBlank(this.values.get(spec.name()))) {
                throw new InvalidParameterException(
                    "Parameter '" + spec.name() + "' is required for " + analysis.getToolName());
            }
        }
    }

    public int integer(String name) {
        Object value = valueOrDefault(name);
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw typeError(name, "an integer");
            }
            return n.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw typeError(name, "an integer");
            }
        }
        throw typeError(name, "an integer");
    }

    public double number(String name) {
        return optionalNumber(name).orElseThrow(() -> typeError(name, "a number"));
    }

    public Optional<Double> optionalNumber(String name) {
        Object value = valueOrDefault(name);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                throw typeError(name, "a number");
            }
        }
        throw typeError(name, "a number");
    }

    public String string(String name) {
        return optionalString(name).orElseThrow(() -> typeError(name, "a string"));
    }

    public Optional<String> optionalString(String name) {
        Object value = valueOrDefault(name);
        if (value == null || isBlank(value)) {
            return Optional.empty();
        }
        if (value instanceof String || value instanceof Number) {
            return Optional.of(value.toString().trim());
        }
        throw typeError(name, "a string");
    }

    /** Accepts a JSON array or a comma-separated string. */
    public List<String> stringList(String name) {
        Object value = valueOrDefault(name);
        if (value instanceof Collection<?> items) {
            return items.stream()
                .filter(item -> item != null && !item.toString().isBlank())
                .map(item -> item.toString().trim())
                .toList();
        }
        if (value instanceof String s) {
            return List.of(s.split(",")).stream().map(String::trim).filter(v -> !v.isEmpty()).toList();
        }
        throw typeError(name, "an array of strings");
    }

    private Object valueOrDefault(String name) {
        ParameterSpec spec = analysis.getParameters().stream()
            .filter(p -> p.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                analysis.getToolName() + " declares no parameter '" + name + "'"));
        Object value = values.get(name);
        return value != null ? value : spec.defaultValue();
    }

    private InvalidParameterException typeError(String name, String expected) {
        return new InvalidParameterException(
            "Parameter '" + name + "' of " + analysis.getToolName() + " must be " + expected);
    }

    private static boolean isBlank(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        return value instanceof Collection<?> c && c.isEmpty();
    }
}
