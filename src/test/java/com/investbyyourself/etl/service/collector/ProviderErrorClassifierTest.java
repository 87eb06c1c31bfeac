package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.model.ErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderErrorClassifierTest {

    @Test
    void classifiesStatusCodes() {
        assertThat(ProviderErrorClassifier.classifyStatus(429)).isEqualTo(ErrorKind.TRANSIENT_PROVIDER);
        assertThat(ProviderErrorClassifier.classifyStatus(408)).isEqualTo(ErrorKind.TRANSIENT_PROVIDER);
        assertThat(ProviderErrorClassifier.classifyStatus(502)).isEqualTo(ErrorKind.TRANSIENT_PROVIDER);
        assertThat(ProviderErrorClassifier.classifyStatus(401)).isEqualTo(ErrorKind.AUTH_OR_VALIDATION);
        assertThat(ProviderErrorClassifier.classifyStatus(404)).isEqualTo(ErrorKind.AUTH_OR_VALIDATION);
    }

    @Test
    void ioFailureIsTransient() {
        ProviderCallException e = ProviderErrorClassifier.classify("fred", "GDP",
                new ResourceAccessException("Connection refused"));

        assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSIENT_PROVIDER);
        assertThat(e.getStatus()).isZero();
    }

    @Test
    void masksApiKeys() {
        assertThat(ProviderErrorClassifier.maskApiKey("https://x/query?function=OVERVIEW&apikey=secret&symbol=IBM"))
                .isEqualTo("https://x/query?function=OVERVIEW&apikey=****&symbol=IBM");
        assertThat(ProviderErrorClassifier.maskApiKey("https://x/obs?api_key=abc")).isEqualTo("https://x/obs?api_key=****");
    }
}
