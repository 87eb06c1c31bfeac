package com.investbyyourself.etl.service.transform;

import java.math.BigDecimal;

/**
 * Provider field to canonical field. {@code multiplier} converts provider units,
 * e.g. a fraction into a percentage.
 */
public record FieldMapping(String sourceField, String target, BigDecimal multiplier) {
}
