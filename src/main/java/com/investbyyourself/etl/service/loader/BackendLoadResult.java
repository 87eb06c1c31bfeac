package com.investbyyourself.etl.service.loader;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.DataVersion;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.ErrorSample;
import com.investbyyourself.etl.model.LoadingMetrics;

import java.util.List;

/**
 * @param failure set when the backend as a whole failed (unreachable after retries,
 *                misconfigured); scope- and record-level failures are in {@code errors}
 */
public record BackendLoadResult(BackendKind backend,
                                LoadingMetrics metrics,
                                List<DataVersion> versions,
                                List<String> failedScopes,
                                List<ErrorSample> errors,
                                ErrorKind failure) {

    public BackendLoadResult {
        versions = List.copyOf(versions);
        failedScopes = List.copyOf(failedScopes);
        errors = List.copyOf(errors);
    }

    public boolean backendFailed() {
        return failure != null;
    }
}
