package com.investbyyourself.etl.service.transform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.investbyyourself.etl.model.FieldType;
import com.investbyyourself.etl.service.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Declarative provider-to-canonical mapping, parsed and validated once when loaded.
 * Unknown providers have no mappings: all their fields end up in the extras bucket.
 */
public final class FieldMappingTable {

    private static final Logger logger = LoggerFactory.getLogger(FieldMappingTable.class);

    public static final int DEFAULT_PRIORITY = 100;

    private final String version;
    private final Map<String, CanonicalField> canonicalFields;
    private final Map<String, ProviderMapping> providers;

    public FieldMappingTable(String version,
                             Map<String, CanonicalField> canonicalFields,
                             Map<String, ProviderMapping> providers) {
        this.version = version;
        this.canonicalFields = Collections.unmodifiableMap(new TreeMap<>(canonicalFields));
        this.providers = Collections.unmodifiableMap(new TreeMap<>(providers));
        validate();
    }

    public static FieldMappingTable load(InputStream json, ObjectMapper objectMapper) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new ConfigurationException("Field mapping table is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigurationException("Field mapping table must be a JSON object");
        }

        Map<String, CanonicalField> canonical = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.path("canonicalFields").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode def = entry.getValue();
            canonical.put(entry.getKey(), new CanonicalField(
                    entry.getKey(),
                    parseType(entry.getKey(), def.path("type").asText()),
                    def.path("required").asBoolean(false),
                    decimalOrNull(def.get("min")),
                    decimalOrNull(def.get("max"))));
        }

        Map<String, ProviderMapping> providers = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> providerNodes = root.path("providers").fields();
        while (providerNodes.hasNext()) {
            Map.Entry<String, JsonNode> entry = providerNodes.next();
            String provider = entry.getKey();
            JsonNode def = entry.getValue();
            List<String> expected = new ArrayList<>();
            def.path("expectedFields").forEach(n -> expected.add(n.asText()));
            Map<String, FieldMapping> mappings = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> sourceFields = def.path("fields").fields();
            while (sourceFields.hasNext()) {
                Map.Entry<String, JsonNode> sf = sourceFields.next();
                JsonNode mapping = sf.getValue();
                String target = mapping.isTextual() ? mapping.asText() : mapping.path("target").asText(null);
                BigDecimal multiplier = mapping.isObject() ? decimalOrNull(mapping.get("multiplier")) : null;
                mappings.put(sf.getKey(), new FieldMapping(sf.getKey(), target, multiplier));
            }
            providers.put(provider, new ProviderMapping(provider, def.path("priority").asInt(DEFAULT_PRIORITY),
                    expected, mappings));
        }

        FieldMappingTable table = new FieldMappingTable(root.path("version").asText("unversioned"), canonical, providers);
        logger.info("Loaded field mapping table version={} canonicalFields={} providers={}",
                table.version, canonical.size(), providers.keySet());
        return table;
    }

    private void validate() {
        for (ProviderMapping provider : providers.values()) {
            Set<String> targets = new HashSet<>();
            for (FieldMapping mapping : provider.fields().values()) {
                if (mapping.target() == null || mapping.target().isBlank()) {
                    throw new ConfigurationException("Mapping " + provider.provider() + "." + mapping.sourceField()
                            + " has no target field");
                }
                CanonicalField field = canonicalFields.get(mapping.target());
                if (field == null) {
                    throw new ConfigurationException("Mapping " + provider.provider() + "." + mapping.sourceField()
                            + " targets unknown canonical field " + mapping.target());
                }
                if (!targets.add(mapping.target())) {
                    throw new ConfigurationException("Provider " + provider.provider()
                            + " maps more than one field onto " + mapping.target());
                }
                if (mapping.multiplier() != null && field.type() != FieldType.DECIMAL) {
                    throw new ConfigurationException("Multiplier on non-decimal field " + mapping.target());
                }
            }
            for (String expected : provider.expectedFields()) {
                if (!canonicalFields.containsKey(expected)) {
                    throw new ConfigurationException("Provider " + provider.provider()
                            + " expects unknown canonical field " + expected);
                }
            }
        }
    }

    private static FieldType parseType(String field, String type) {
        try {
            return FieldType.valueOf(type.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Canonical field " + field + " has unknown type '" + type + "'", e);
        }
    }

    private static BigDecimal decimalOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return new BigDecimal(node.asText());
    }

    public String version() {
        return version;
    }

    public Map<String, CanonicalField> canonicalFields() {
        return canonicalFields;
    }

    public Optional<CanonicalField> canonicalField(String name) {
        return Optional.ofNullable(canonicalFields.get(name));
    }

    public Optional<ProviderMapping> provider(String provider) {
        return Optional.ofNullable(providers.get(provider));
    }

    public int priority(String provider) {
        ProviderMapping mapping = providers.get(provider);
        return mapping == null ? DEFAULT_PRIORITY : mapping.priority();
    }

    public Set<String> providers() {
        return providers.keySet();
    }
}
