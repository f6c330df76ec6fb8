package com.automate.ScanOps.Models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.util.Locale;

public enum ParameterType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean");

    private final String wireName;

    ParameterType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Runtime type check of a decoded JSON value. */
    public boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
        };
    }

    @JsonCreator
    public static ParameterType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Parameter type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("integer".equals(normalized)) {
            return NUMBER;
        }
        for (ParameterType t : values()) {
            if (t.wireName.equals(normalized)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unsupported parameter type: " + value);
    }

    /** Text form of a parameter value as it appears on a command line. */
    public static String stringify(Object value) {
        if (value instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d)) {
                return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            }
        }
        return String.valueOf(value);
    }
}
