package com.p14n.upsbridge.data;

import java.util.Locale;
import java.util.Optional;

/**
 * Value types a device field can carry, with their text encodings on the bus.
 */
public enum FieldType {
    DECIMAL {
        @Override
        public Optional<Object> parse(String text) {
            try {
                double d = Double.parseDouble(text.trim());
                return Double.isFinite(d) ? Optional.of(d) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
    },
    INTEGER {
        @Override
        public Optional<Object> parse(String text) {
            String t = text.trim();
            try {
                return Optional.of(Integer.parseInt(t));
            } catch (NumberFormatException e) {
                // NUT reports some counters as "120.00"
                return DECIMAL.parse(t).map(d -> (Object) (int) ((Double) d).doubleValue());
            }
        }
    },
    TEXT {
        @Override
        public Optional<Object> parse(String text) {
            return Optional.of(text);
        }
    },
    FLAG {
        @Override
        public Optional<Object> parse(String text) {
            switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "1":
                case "true":
                case "on":
                    return Optional.of(Boolean.TRUE);
                case "0":
                case "false":
                case "off":
                    return Optional.of(Boolean.FALSE);
                default:
                    return Optional.empty();
            }
        }

        @Override
        public String format(Object value) {
            return Boolean.TRUE.equals(value) ? "1" : "0";
        }
    };

    /**
     * Parses a payload. Empty input and unparsable values yield empty.
     */
    public Optional<Object> parseValue(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        return parse(text);
    }

    protected abstract Optional<Object> parse(String text);

    public String format(Object value) {
        return String.valueOf(value);
    }
}
