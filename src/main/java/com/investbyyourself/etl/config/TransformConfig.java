package com.investbyyourself.etl.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.investbyyourself.etl.service.ConfigurationException;
import com.investbyyourself.etl.service.transform.FieldMappingTable;
import com.investbyyourself.etl.service.transform.RuleSet;
import com.investbyyourself.etl.service.transform.StandardMetricCalculators;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

@Configuration
public class TransformConfig {

    @Bean
    public FieldMappingTable fieldMappingTable(EtlProperties properties,
                                               ResourceLoader resourceLoader,
                                               ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(properties.getMappingLocation());
        if (!resource.exists()) {
            throw new ConfigurationException("Field mapping table not found at " + properties.getMappingLocation());
        }
        try (InputStream in = resource.getInputStream()) {
            return FieldMappingTable.load(in, objectMapper);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read field mapping table " + properties.getMappingLocation()
                    + ": " + e.getMessage(), e);
        }
    }

    @Bean
    public RuleSet ruleSet(FieldMappingTable fieldMappingTable, EtlProperties properties) {
        return new RuleSet(fieldMappingTable.version(), fieldMappingTable, StandardMetricCalculators.all(),
                properties.getQuality().getMinScore());
    }
}
