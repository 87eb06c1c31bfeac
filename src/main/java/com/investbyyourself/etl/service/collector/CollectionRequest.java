package com.investbyyourself.etl.service.collector;

import com.investbyyourself.etl.model.TimeWindow;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * What to collect. Entity keys are de-duplicated, keeping their first position so the
 * iteration order stays fixed.
 */
public record CollectionRequest(List<String> entityKeys, TimeWindow window, Map<String, String> options) {

    public CollectionRequest {
        entityKeys = List.copyOf(new LinkedHashSet<>(entityKeys == null ? List.of() : entityKeys));
        window = window == null ? TimeWindow.open() : window;
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static CollectionRequest of(List<String> entityKeys) {
        return new CollectionRequest(entityKeys, TimeWindow.open(), Map.of());
    }
}
