package com.investbyyourself.etl.dto;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.service.loader.BackendLoadResult;

import java.util.List;

public record BackendSummary(BackendKind backend,
                             int inserted,
                             int updated,
                             int deleted,
                             int skipped,
                             int failed,
                             List<String> failedScopes,
                             ErrorKind failure) {

    public static BackendSummary of(BackendLoadResult result) {
        return new BackendSummary(result.backend(),
                result.metrics().inserted(),
                result.metrics().updated(),
                result.metrics().deleted(),
                result.metrics().skipped(),
                result.metrics().failed(),
                result.failedScopes(),
                result.failure());
    }
}
