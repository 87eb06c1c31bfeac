package com.investbyyourself.etl.model;

/**
 * How an incoming record set reconciles against what a backend already holds for a scope.
 */
public enum LoadingStrategy {
    /** Insert new keys; a key collision fails that record and leaves stored data untouched. */
    INSERT_ONLY,
    /** Update existing keys field-by-field; new keys are skipped. */
    UPDATE_ONLY,
    /** Insert new keys, merge existing ones (incoming fields win). */
    UPSERT,
    /** Swap the whole scope for the incoming set. */
    REPLACE,
    /** Always add rows, key collisions included. */
    APPEND,
    /** Write only new or changed records, nothing when the scope content is unchanged. */
    INCREMENTAL
}
