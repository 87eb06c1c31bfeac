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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * FRED series observations (UNRATE, FEDFUNDS, GDP, ...). Each observation becomes one
 * payload; FRED marks missing observations with {@code "."} and those carry no value.
 */
public class FredClient implements ProviderClient {

    public static final String PROVIDER = "fred";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public FredClient(RestClient restClient, ObjectMapper objectMapper, String apiKey) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public List<Map<String, Object>> fetch(String seriesId, TimeWindow window) throws ProviderCallException {
        String body;
        try {
            body = restClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("/fred/series/observations")
                                .queryParam("series_id", seriesId)
                                .queryParam("api_key", apiKey)
                                .queryParam("file_type", "json");
                        if (window.from() != null) {
                            uriBuilder.queryParam("observation_start", window.from());
                        }
                        if (window.to() != null) {
                            uriBuilder.queryParam("observation_end", window.to());
                        }
                        return uriBuilder.build();
                    })
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw ProviderErrorClassifier.classify(PROVIDER, seriesId, e);
        }

        JsonNode observations;
        try {
            observations = objectMapper.readTree(body == null ? "{}" : body).path("observations");
        } catch (JsonProcessingException e) {
            throw new ProviderCallException(ErrorKind.TRANSIENT_PROVIDER, 200,
                    PROVIDER + " returned malformed JSON for " + seriesId, e);
        }
        if (!observations.isArray()) {
            throw new ProviderCallException(ErrorKind.AUTH_OR_VALIDATION, 200,
                    PROVIDER + " response has no observations for " + seriesId);
        }

        List<Map<String, Object>> payloads = new ArrayList<>(observations.size());
        for (JsonNode observation : observations) {
            Map<String, Object> payload = new TreeMap<>();
            payload.put("series_id", seriesId);
            payload.put("date", observation.path("date").asText());
            String value = observation.path("value").asText(".");
            if (!".".equals(value)) {
                payload.put("value", value);
            }
            payloads.add(payload);
        }
        return payloads;
    }
}
