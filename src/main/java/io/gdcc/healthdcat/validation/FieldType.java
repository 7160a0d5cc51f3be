package io.gdcc.healthdcat.validation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Set;

/** Value formats a column can be checked against. The lower-case name is the issue rule id. */
public enum FieldType {
    STRING {
        @Override
        boolean accepts(Object value) {
            return true;
        }
    },
    INTEGER {
        @Override
        boolean accepts(Object value) {
            if (value instanceof Integer
                    || value instanceof Long
                    || value instanceof Short
                    || value instanceof BigInteger) {
                return true;
            }
            try {
                new BigInteger(value.toString().trim());
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
    },
    DECIMAL {
        @Override
        boolean accepts(Object value) {
            if (value instanceof Number) {
                return true;
            }
            try {
                new BigDecimal(value.toString().trim());
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
    },
    BOOLEAN {
        private final Set<String> tokens = Set.of("true", "false", "yes", "no", "1", "0");

        @Override
        boolean accepts(Object value) {
            return value instanceof Boolean
                    || tokens.contains(value.toString().trim().toLowerCase(Locale.ROOT));
        }
    },
    DATE {
        @Override
        boolean accepts(Object value) {
            try {
                LocalDate.parse(value.toString().trim());
                return true;
            } catch (DateTimeParseException e) {
                return false;
            }
        }
    },
    URI {
        @Override
        boolean accepts(Object value) {
            try {
                return new java.net.URI(value.toString().trim()).isAbsolute();
            } catch (URISyntaxException e) {
                return false;
            }
        }
    };

    /** Whether a present, non-blank value is well formed for this type. */
    abstract boolean accepts(Object value);

    public String ruleId() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FieldType fromRuleId(String id) {
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown field type '" + id + "'", e);
        }
    }
}
