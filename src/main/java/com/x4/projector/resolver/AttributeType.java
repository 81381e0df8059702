package com.x4.projector.resolver;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Target types of resolved attributes and how raw strings coerce to them.
 */
public enum AttributeType {

    INT {
        @Override
        Object coerce(String raw) {
            // accepts "12" and "12.0", rejects "12.5"
            BigDecimal value = new BigDecimal(raw.trim()).stripTrailingZeros();
            if (value.scale() > 0) {
                throw new ArithmeticException("not an integer: " + raw);
            }
            // checked on digits so exponents like 1e100000000 never expand
            if ((long) value.precision() - value.scale() > MAX_INT_DIGITS) {
                throw new ArithmeticException("integer out of range: " + raw);
            }
            return value.intValueExact();
        }
    },

    FLOAT {
        @Override
        Object coerce(String raw) {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new NumberFormatException("not a finite number: " + raw);
            }
            return value;
        }
    },

    STRING {
        @Override
        Object coerce(String raw) {
            return raw;
        }
    },

    /**
     * Whitespace separated tokens, e.g. ware tags.
     */
    LIST {
        @Override
        Object coerce(String raw) {
            return Arrays.stream(raw.trim().split("\\s+"))
                    .filter(token -> !token.isEmpty())
                    .toList();
        }
    };

    private static final int MAX_INT_DIGITS = 10;

    /**
     * @throws NumberFormatException or {@link ArithmeticException} when the raw
     *         value does not fit the type
     */
    abstract Object coerce(String raw);

    /**
     * Coerces a value the profile declares as default; lists default to empty.
     */
    Object defaultOrEmpty(Object defaultValue) {
        if (defaultValue == null && this == LIST) {
            return List.of();
        }
        return defaultValue;
    }
}
