package com.investbyyourself.etl.service.transform;

import com.investbyyourself.etl.model.CanonicalValue;
import com.investbyyourself.etl.model.FieldType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Converts untyped provider values into canonical values.
 */
final class ValueCoercer {

    private ValueCoercer() {
    }

    static CanonicalValue coerce(Object raw, FieldType type, BigDecimal multiplier) throws CoercionException {
        if (raw == null) {
            throw new CoercionException("null value");
        }
        switch (type) {
            case DECIMAL:
                BigDecimal decimal = toDecimal(raw);
                return CanonicalValue.decimal(multiplier == null ? decimal : decimal.multiply(multiplier));
            case DATE:
                return CanonicalValue.date(toDate(raw));
            case TEXT:
                String text = raw.toString().trim();
                if (text.isEmpty()) {
                    throw new CoercionException("blank text");
                }
                return CanonicalValue.text(text);
            default:
                throw new CoercionException("unsupported type " + type);
        }
    }

    static String asText(Object raw) {
        if (raw instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        return String.valueOf(raw);
    }

    private static BigDecimal toDecimal(Object raw) throws CoercionException {
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        if (raw instanceof Double || raw instanceof Float) {
            double d = ((Number) raw).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new CoercionException("non-finite number " + raw);
            }
            return BigDecimal.valueOf(d);
        }
        if (raw instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        String text = raw.toString().trim().replace(",", "");
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new CoercionException("'" + raw + "' is not a decimal");
        }
    }

    private static LocalDate toDate(Object raw) throws CoercionException {
        if (raw instanceof LocalDate date) {
            return date;
        }
        String text = raw.toString().trim();
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new CoercionException("'" + raw + "' is not an ISO date");
        }
    }

    static final class CoercionException extends Exception {
        CoercionException(String message) {
            super(message);
        }
    }
}
