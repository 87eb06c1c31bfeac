package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.model.ErrorKind;

public record KeyFailure(String entityKey, ErrorKind kind, String message, int attempts) {
}
