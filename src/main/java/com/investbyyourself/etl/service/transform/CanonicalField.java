package com.investbyyourself.etl.service.transform;

import com.investbyyourself.etl.model.FieldType;

import java.math.BigDecimal;

/**
 * One field of the canonical schema. {@code min}/{@code max} bound decimal values;
 * a required field that fails coercion makes the record invalid.
 */
public record CanonicalField(String name, FieldType type, boolean required, BigDecimal min, BigDecimal max) {

    public boolean inRange(BigDecimal value) {
        return (min == null || value.compareTo(min) >= 0) && (max == null || value.compareTo(max) <= 0);
    }
}
