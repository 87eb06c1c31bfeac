package com.investbyyourself.etl.service.transform;

import java.util.List;
import java.util.Map;

public record ProviderMapping(String provider,
                              int priority,
                              List<String> expectedFields,
                              Map<String, FieldMapping> fields) {

    public ProviderMapping {
        expectedFields = List.copyOf(expectedFields);
        fields = Map.copyOf(fields);
    }
}
