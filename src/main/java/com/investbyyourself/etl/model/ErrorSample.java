package com.investbyyourself.etl.model;

/**
 * One reported failure. {@code subject} is an entity key, record key, scope or
 * component name depending on {@code stage}.
 */
public record ErrorSample(String stage, String subject, ErrorKind kind, String message) {
}
