package com.batchbridge.domain.service.ingestion;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;

/**
 * Typed access to a row's fields. Blank values count as absent.
 */
final class RowFields {

    /** Amount columns are NUMERIC(19, 4). */
    static final int AMOUNT_SCALE = 4;
    static final int AMOUNT_INTEGER_DIGITS = 15;

    private final Map<String, String> fields;

    RowFields(Map<String, String> fields) {
        this.fields = fields;
    }

    String optional(String name) {
        String value = fields.get(name);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    String required(String name) throws InvalidRecordException {
        String value = optional(name);
        if (value == null) {
            throw new InvalidRecordException(name + " is required");
        }
        return value;
    }

    /**
     * Decimal that fits an amount column: at most four fraction digits and
     * fifteen integer digits once trailing zeros are dropped.
     */
    BigDecimal decimal(String name) throws InvalidRecordException {
        String value = required(name);
        BigDecimal parsed;
        BigDecimal normalized;
        try {
            parsed = new BigDecimal(value);
            normalized = parsed.stripTrailingZeros();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidRecordException(name + " is not a number: " + value);
        }
        if (normalized.scale() > AMOUNT_SCALE) {
            throw new InvalidRecordException(name + " has more than " + AMOUNT_SCALE + " decimal places: " + value);
        }
        if ((long) normalized.precision() - normalized.scale() > AMOUNT_INTEGER_DIGITS) {
            throw new InvalidRecordException(name + " is out of range: " + value);
        }
        return parsed;
    }

    int nonNegativeInt(String name) throws InvalidRecordException {
        String value = required(name);
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 0) {
                throw new InvalidRecordException(name + " must not be negative: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new InvalidRecordException(name + " is not an integer: " + value);
        }
    }

    Long optionalNonNegativeLong(String name) throws InvalidRecordException {
        String value = optional(name);
        if (value == null) {
            return null;
        }
        long parsed;
        try {
            parsed = Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidRecordException(name + " is not an integer: " + value);
        }
        if (parsed < 0) {
            throw new InvalidRecordException(name + " must not be negative: " + value);
        }
        return parsed;
    }

    LocalDate date(String name) throws InvalidRecordException {
        return parseDate(name, required(name));
    }

    LocalDate optionalDate(String name) throws InvalidRecordException {
        String value = optional(name);
        return value == null ? null : parseDate(name, value);
    }

    Instant instant(String name) throws InvalidRecordException {
        String value = required(name);
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException(name + " is not an ISO-8601 instant: " + value);
        }
    }

    String currency(String name) throws InvalidRecordException {
        String value = required(name).toUpperCase(Locale.ROOT);
        if (!value.matches("[A-Z]{3}")) {
            throw new InvalidRecordException(name + " is not an ISO-4217 code: " + value);
        }
        return value;
    }

    private static LocalDate parseDate(String name, String value) throws InvalidRecordException {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException(name + " is not an ISO date: " + value);
        }
    }
}
