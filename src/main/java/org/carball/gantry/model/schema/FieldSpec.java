package org.carball.gantry.model.schema;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Declared shape of one record field: value kind plus simple range or code-list checks.
 */
@Value
@Builder
public class FieldSpec {

    String name;
    FieldKind kind;
    String description;
    Long min;
    Long max;
    @Singular
    Set<String> allowedValues;

    /**
     * Converts a loosely typed value (as produced by JSON parsing) into the field's Java type.
     *
     * @throws IllegalArgumentException when the value cannot be converted or fails a range check
     */
    public Object coerce(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException(name + " is missing");
        }
        Object typed = switch (kind) {
            case STRING -> coerceString(raw);
            case INTEGER -> coerceInteger(raw);
            case TIMESTAMP -> coerceTimestamp(raw);
        };
        String problem = check(typed);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        return typed;
    }

    /**
     * Checks an already typed value. Returns a description of the problem, or null when valid.
     */
    public String check(Object value) {
        if (value == null) {
            return name + " is missing";
        }
        switch (kind) {
            case STRING -> {
                if (!(value instanceof String s) || s.isBlank()) {
                    return name + " must be a non-empty string";
                }
            }
            case INTEGER -> {
                if (!(value instanceof Long number)) {
                    return name + " must be an integer";
                }
                if (min != null && number < min) {
                    return name + " below minimum " + min + ": " + number;
                }
                if (max != null && number > max) {
                    return name + " above maximum " + max + ": " + number;
                }
            }
            case TIMESTAMP -> {
                if (!(value instanceof LocalDateTime)) {
                    return name + " must be a timestamp";
                }
            }
        }
        if (!allowedValues.isEmpty() && !allowedValues.contains(String.valueOf(value))) {
            return name + " has unexpected value " + value + " (allowed " + allowedValues + ")";
        }
        return null;
    }

    private String coerceString(Object raw) {
        if (raw instanceof Number || raw instanceof String || raw instanceof Boolean) {
            return String.valueOf(raw).trim();
        }
        throw new IllegalArgumentException(name + " must be a scalar, got " + raw.getClass().getSimpleName());
    }

    private Long coerceInteger(Object raw) {
        try {
            BigDecimal decimal;
            if (raw instanceof Number number) {
                decimal = new BigDecimal(number.toString());
            } else if (raw instanceof String text) {
                decimal = new BigDecimal(text.trim());
            } else {
                throw new IllegalArgumentException(name + " must be numeric, got " + raw.getClass().getSimpleName());
            }
            return decimal.setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + raw, e);
        }
    }

    private LocalDateTime coerceTimestamp(Object raw) {
        if (raw instanceof LocalDateTime dateTime) {
            return dateTime;
        }
        String text = String.valueOf(raw).trim().replace(' ', 'T');
        try {
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toLocalDateTime();
            } catch (DateTimeParseException nested) {
                throw new IllegalArgumentException(name + " is not an ISO timestamp: " + raw, nested);
            }
        }
    }
}
