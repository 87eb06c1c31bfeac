package com.investbyyourself.etl.model;

/**
 * Unit of atomic replacement and versioning for a load.
 */
public enum ScopeGranularity {
    /** One scope per entity key. */
    ENTITY,
    /** One scope per entity key and as-of date partition. */
    ENTITY_DATE
}
