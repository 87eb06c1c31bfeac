package com.investbyyourself.etl.service.collector.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.TimeWindow;
import com.investbyyourself.etl.service.collector.ProviderCallException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class YahooFinanceClientTest {

    private MockRestServiceServer server;
    private YahooFinanceClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://query1.finance.yahoo.com");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new YahooFinanceClient(builder.build(), new ObjectMapper());
    }

    @Test
    void flattensModulesIntoOnePayload() throws Exception {
        server.expect(requestTo(startsWith("https://query1.finance.yahoo.com/v10/finance/quoteSummary/AAPL")))
                .andRespond(withSuccess("""
                        {"quoteSummary":{"result":[{
                          "price":{"regularMarketPrice":{"raw":170.5,"fmt":"170.50"},"currency":"USD","longName":"Apple Inc."},
                          "financialData":{"totalRevenue":{"raw":383285000000,"fmt":"383.29B"},"ebitda":{}}
                        }],"error":null}}
                        """, MediaType.APPLICATION_JSON));

        List<Map<String, Object>> payloads = client.fetch("AAPL", TimeWindow.open());

        assertThat(payloads).singleElement().satisfies(p -> {
            assertThat(p).containsEntry("symbol", "AAPL").containsEntry("currency", "USD")
                    .containsEntry("longName", "Apple Inc.")
                    .doesNotContainKey("ebitda");
            assertThat((BigDecimal) p.get("regularMarketPrice")).isEqualByComparingTo("170.5");
            assertThat((BigDecimal) p.get("totalRevenue")).isEqualByComparingTo("383285000000");
        });
    }

    @Test
    void emptyResultIsValidationFailure() {
        server.expect(requestTo(startsWith("https://query1.finance.yahoo.com/v10/finance/quoteSummary/ZZZZ")))
                .andRespond(withSuccess("{\"quoteSummary\":{\"result\":null,\"error\":{\"description\":\"Quote not found\"}}}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetch("ZZZZ", TimeWindow.open()))
                .isInstanceOf(ProviderCallException.class)
                .satisfies(e -> assertThat(((ProviderCallException) e).getKind()).isEqualTo(ErrorKind.AUTH_OR_VALIDATION));
    }

    @Test
    void tooManyRequestsIsTransient() {
        server.expect(requestTo(startsWith("https://query1.finance.yahoo.com/v10/finance/quoteSummary/AAPL")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.fetch("AAPL", TimeWindow.open()))
                .isInstanceOf(ProviderCallException.class)
                .satisfies(e -> assertThat(((ProviderCallException) e).getKind()).isEqualTo(ErrorKind.TRANSIENT_PROVIDER));
    }
}
