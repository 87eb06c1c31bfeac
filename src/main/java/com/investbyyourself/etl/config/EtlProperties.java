package com.investbyyourself.etl.config;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.model.LoadingStrategy;
import com.investbyyourself.etl.model.ScopeGranularity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All {@code etl.*} settings.
 */
@Data
@ConfigurationProperties(prefix = "etl")
public class EtlProperties {

    private Map<String, Provider> providers = new LinkedHashMap<>();
    private Orchestrator orchestrator = new Orchestrator();
    private Loader loader = new Loader();
    private Quality quality = new Quality();
    private Archive archive = new Archive();
    private Cache cache = new Cache();
    private Run run = new Run();
    private Schedule schedule = new Schedule();
    private String mappingLocation = "classpath:mappings/field-mappings.json";

    @Data
    public static class Provider {
        private boolean enabled = false;
        private String baseUrl;
        private String apiKey;
        private int priority = 100;
        private int callsPerMinute = 60;
        private int callsPerDay = 0;
        private Duration maxWait = Duration.ofSeconds(30);
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofMillis(500);
        private Duration backoffMax = Duration.ofSeconds(10);
        private Duration timeout = Duration.ofSeconds(15);
        private List<String> functions = new ArrayList<>();
    }

    @Data
    public static class Orchestrator {
        private int concurrency = 4;
        private Duration collectorTimeout = Duration.ofMinutes(5);
        private Duration cancellationGrace = Duration.ofSeconds(5);
    }

    @Data
    public static class Loader {
        private LoadingStrategy defaultStrategy = LoadingStrategy.UPSERT;
        private Set<BackendKind> defaultBackends = EnumSet.of(BackendKind.RELATIONAL);
        private Map<BackendKind, Integer> batchSize = new EnumMap<>(BackendKind.class);
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofMillis(250);
        private Duration backoffMax = Duration.ofSeconds(5);
        private ScopeGranularity scopeGranularity = ScopeGranularity.ENTITY;

        public int batchSizeFor(BackendKind kind) {
            Integer size = batchSize.get(kind);
            return size == null || size < 1 ? 500 : size;
        }
    }

    @Data
    public static class Quality {
        private BigDecimal minScore = new BigDecimal("0.6");
    }

    @Data
    public static class Archive {
        private boolean enabled = true;
        private Path root = Path.of("./data/archive");
        private boolean compression = true;
    }

    @Data
    public static class Cache {
        private boolean enabled = true;
        private String keyPrefix = "investbyyourself";
        private Duration ttl = Duration.ofHours(1);
    }

    @Data
    public static class Run {
        private int errorSampleLimit = 20;
        private String defaultDataset = "fundamentals";
    }

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 6 * * MON-FRI";
        private List<String> providers = new ArrayList<>();
        private List<String> entityKeys = new ArrayList<>();
        private String dataset = "fundamentals";
        private LoadingStrategy strategy = LoadingStrategy.INCREMENTAL;
        private Set<BackendKind> backends = EnumSet.of(BackendKind.RELATIONAL);
    }
}
