package com.investbyyourself.etl.service.collector.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investbyyourself.etl.model.ErrorKind;
import com.investbyyourself.etl.model.TimeWindow;
import com.investbyyourself.etl.service.collector.ProviderCallException;
import com.investbyyourself.etl.service.collector.ProviderClient;
import com.investbyyourself.etl.service.collector.ProviderErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Alpha Vantage fundamentals. One fetch issues one {@code /query} call per configured
 * function (OVERVIEW, BALANCE_SHEET, INCOME_STATEMENT) and folds the answers into a
 * single payload. Statement functions contribute their latest quarterly report.
 */
public class AlphaVantageClient implements ProviderClient {

    private static final Logger logger = LoggerFactory.getLogger(AlphaVantageClient.class);

    public static final String PROVIDER = "alphavantage";
    public static final List<String> DEFAULT_FUNCTIONS = List.of("OVERVIEW", "BALANCE_SHEET", "INCOME_STATEMENT");

    private static final Set<String> MISSING_VALUES = Set.of("None", "-", "");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final List<String> functions;

    public AlphaVantageClient(RestClient restClient, ObjectMapper objectMapper, String apiKey, List<String> functions) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.functions = functions == null || functions.isEmpty() ? DEFAULT_FUNCTIONS : List.copyOf(functions);
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public int callsPerFetch() {
        return functions.size();
    }

    @Override
    public List<Map<String, Object>> fetch(String symbol, TimeWindow window) throws ProviderCallException {
        Map<String, Object> payload = new TreeMap<>();
        for (String function : functions) {
            JsonNode root = call(function, symbol);
            JsonNode section = "OVERVIEW".equals(function) ? root : latestReport(root);
            copyScalars(section, payload);
        }
        if (payload.isEmpty()) {
            throw new ProviderCallException(ErrorKind.AUTH_OR_VALIDATION, 200,
                    PROVIDER + " returned no data for " + symbol);
        }
        payload.putIfAbsent("Symbol", symbol);
        return List.of(payload);
    }

    private JsonNode call(String function, String symbol) throws ProviderCallException {
        logger.debug("provider={} function={} symbol={} apikey=****", PROVIDER, function, symbol);
        String body;
        try {
            body = restClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/query")
                            .queryParam("function", function)
                            .queryParam("symbol", symbol)
                            .queryParam("apikey", apiKey)
                            .build())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw ProviderErrorClassifier.classify(PROVIDER, symbol, e);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new ProviderCallException(ErrorKind.TRANSIENT_PROVIDER, 200,
                    PROVIDER + " returned malformed JSON for " + symbol, e);
        }
        if (root.hasNonNull("Note") || root.hasNonNull("Information")) {
            String note = root.hasNonNull("Note") ? root.get("Note").asText() : root.get("Information").asText();
            throw new ProviderCallException(ErrorKind.TRANSIENT_PROVIDER, 200,
                    PROVIDER + " throttled " + function + " for " + symbol + ": " + note);
        }
        if (root.hasNonNull("Error Message")) {
            throw new ProviderCallException(ErrorKind.AUTH_OR_VALIDATION, 200,
                    PROVIDER + " rejected " + function + " for " + symbol + ": " + root.get("Error Message").asText());
        }
        return root;
    }

    private JsonNode latestReport(JsonNode root) {
        JsonNode quarterly = root.path("quarterlyReports");
        if (quarterly.isArray() && quarterly.size() > 0) {
            return quarterly.get(0);
        }
        JsonNode annual = root.path("annualReports");
        if (annual.isArray() && annual.size() > 0) {
            return annual.get(0);
        }
        return objectMapper.createObjectNode();
    }

    private void copyScalars(JsonNode node, Map<String, Object> payload) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isValueNode() || value.isNull()) {
                continue;
            }
            String text = value.asText().trim();
            if (!MISSING_VALUES.contains(text)) {
                payload.putIfAbsent(field.getKey(), text);
            }
        }
    }
}
