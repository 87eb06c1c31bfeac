package com.investbyyourself.etl.service.collector.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.TimeWindow;
import com.investbyyourself.etl.service.collector.ProviderCallException;
import com.investbyyourself.etl.service.collector.ProviderClient;
import com.investbyyourself.etl.service.collector.ProviderErrorClassifier;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Yahoo Finance quote summary. Module objects are flattened; {@code {"raw": x, "fmt": ...}}
 * wrappers collapse to their raw value.
 */
public class YahooFinanceClient implements ProviderClient {

    public static final String PROVIDER = "yahoo";
    private static final String MODULES = "price,financialData,defaultKeyStatistics,summaryDetail";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public YahooFinanceClient(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public List<Map<String, Object>> fetch(String symbol, TimeWindow window) throws ProviderCallException {
        String body;
        try {
            body = restClient.get()
                    .uri("/v10/finance/quoteSummary/{symbol}?modules={modules}", symbol, MODULES)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw ProviderErrorClassifier.classify(PROVIDER, symbol, e);
        }

        JsonNode summary;
        try {
            summary = objectMapper.readTree(body == null ? "{}" : body).path("quoteSummary");
        } catch (JsonProcessingException e) {
            throw new ProviderCallException(ErrorKind.TRANSIENT_PROVIDER, 200,
                    PROVIDER + " returned malformed JSON for " + symbol, e);
        }
        JsonNode result = summary.path("result");
        if (!result.isArray() || result.size() == 0) {
            String error = summary.path("error").path("description").asText("empty result");
            throw new ProviderCallException(ErrorKind.AUTH_OR_VALIDATION, 200,
                    PROVIDER + " has no quote summary for " + symbol + ": " + error);
        }

        Map<String, Object> payload = new TreeMap<>();
        payload.put("symbol", symbol);
        Iterator<Map.Entry<String, JsonNode>> modules = result.get(0).fields();
        while (modules.hasNext()) {
            Iterator<Map.Entry<String, JsonNode>> fields = modules.next().getValue().fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Object value = flatten(field.getValue());
                if (value != null) {
                    payload.putIfAbsent(field.getKey(), value);
                }
            }
        }
        return List.of(payload);
    }

    private Object flatten(JsonNode node) {
        if (node.isObject()) {
            JsonNode raw = node.get("raw");
            return raw != null && raw.isNumber() ? raw.decimalValue() : null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            return node.asText();
        }
        return null;
    }
}
