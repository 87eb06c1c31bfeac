package com.investbyyourself.etl.model;

/**
 * Where a raw record came from. Provenance never flows into transformed records.
 */
public record Provenance(String sourceName, String requestId) {
}
