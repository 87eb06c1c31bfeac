package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.model.ErrorKind;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps Spring HTTP client exceptions onto the pipeline's error kinds.
 */
public final class ProviderErrorClassifier {

    private ProviderErrorClassifier() {
    }

    public static ErrorKind classifyStatus(int status) {
        if (status == 429 || status == 408 || status >= 500) {
            return ErrorKind.TRANSIENT_PROVIDER;
        }
        return ErrorKind.AUTH_OR_VALIDATION;
    }

    public static ProviderCallException classify(String provider, String entityKey, RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            return new ProviderCallException(classifyStatus(status), status,
                    provider + " returned HTTP " + status + " for " + entityKey, e);
        }
        if (e instanceof ResourceAccessException) {
            return new ProviderCallException(ErrorKind.TRANSIENT_PROVIDER, 0,
                    provider + " I/O failure for " + entityKey + ": " + maskApiKey(e.getMessage()), e);
        }
        return new ProviderCallException(ErrorKind.TRANSIENT_PROVIDER, 0,
                provider + " call failed for " + entityKey + ": " + maskApiKey(e.getMessage()), e);
    }

    /**
     * Replaces the value of any {@code apikey}/{@code api_key} query parameter.
     */
    public static String maskApiKey(String url) {
        if (url == null) {
            return null;
        }
        return url.replaceAll("(?i)(api_?key=)[^&]*", "$1****");
    }
}
