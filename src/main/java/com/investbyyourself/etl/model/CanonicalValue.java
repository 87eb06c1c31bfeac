package com.investbyyourself.etl.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Typed canonical field value. The value is kept in a normalised text form so that
 * equal values always serialise to the same bytes.
 */
public record CanonicalValue(FieldType type, String value) {

    public CanonicalValue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    public static CanonicalValue decimal(BigDecimal decimal) {
        BigDecimal normalised = decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
        return new CanonicalValue(FieldType.DECIMAL, normalised.toPlainString());
    }

    public static CanonicalValue text(String text) {
        return new CanonicalValue(FieldType.TEXT, text.trim());
    }

    public static CanonicalValue date(LocalDate date) {
        return new CanonicalValue(FieldType.DATE, date.toString());
    }

    public BigDecimal asDecimal() {
        if (type != FieldType.DECIMAL) {
            throw new IllegalStateException("Not a decimal value: " + type);
        }
        return new BigDecimal(value);
    }

    public LocalDate asDate() {
        if (type != FieldType.DATE) {
            throw new IllegalStateException("Not a date value: " + type);
        }
        return LocalDate.parse(value);
    }
}
