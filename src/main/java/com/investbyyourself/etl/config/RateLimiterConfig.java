package com.investbyyourself.etl.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.investbyyourself.etl.service.ConfigurationException;
import com.investbyyourself.etl.service.collector.CollectorRegistry;
import com.investbyyourself.etl.service.collector.ProviderClient;
import com.investbyyourself.etl.service.collector.ProviderRateLimiter;
import com.investbyyourself.etl.service.collector.RateLimitedCollector;
import com.investbyyourself.etl.service.collector.SourceCollector;
import com.investbyyourself.etl.service.collector.provider.AlphaVantageClient;
import com.investbyyourself.etl.service.collector.provider.FredClient;
import com.investbyyourself.etl.service.collector.provider.YahooFinanceClient;
import com.investbyyourself.etl.service.retry.RetryExecutor;
import com.investbyyourself.etl.service.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds one rate-limited collector per enabled provider under {@code etl.providers.*}.
 */
@Configuration
public class RateLimiterConfig {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiterConfig.class);

    static final Map<String, String> DEFAULT_BASE_URLS = Map.of(
            AlphaVantageClient.PROVIDER, "https://www.alphavantage.co",
            FredClient.PROVIDER, "https://api.stlouisfed.org",
            YahooFinanceClient.PROVIDER, "https://query1.finance.yahoo.com");

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; investbyyourself-etl/1.0)";

    @Bean
    public CollectorRegistry collectorRegistry(EtlProperties properties,
                                               RestClient.Builder restClientBuilder,
                                               ObjectMapper objectMapper,
                                               RetryExecutor retryExecutor,
                                               Clock clock) {
        List<SourceCollector> collectors = new ArrayList<>();
        properties.getProviders().forEach((name, provider) -> {
            if (!provider.isEnabled()) {
                logger.info("provider={} disabled", name);
                return;
            }
            RestClient restClient = restClient(restClientBuilder.clone(), name, provider);
            ProviderClient client = providerClient(name, provider, restClient, objectMapper);
            ProviderRateLimiter limiter = new ProviderRateLimiter(name, provider.getCallsPerMinute(),
                    provider.getCallsPerDay(), provider.getMaxWait(), clock);
            RetryPolicy policy = new RetryPolicy(provider.getMaxAttempts(), provider.getBackoffBase(),
                    provider.getBackoffMax());
            collectors.add(new RateLimitedCollector(name, provider.getPriority(), client, limiter, policy,
                    retryExecutor, clock));
            logger.info("provider={} enabled callsPerMinute={} callsPerDay={} priority={}",
                    name, provider.getCallsPerMinute(), provider.getCallsPerDay(), provider.getPriority());
        });
        return new CollectorRegistry(collectors);
    }

    private RestClient restClient(RestClient.Builder builder, String name, EtlProperties.Provider provider) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) provider.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) provider.getTimeout().toMillis());
        String baseUrl = provider.getBaseUrl() != null && !provider.getBaseUrl().isBlank()
                ? provider.getBaseUrl()
                : DEFAULT_BASE_URLS.get(name);
        if (baseUrl == null) {
            throw new ConfigurationException("Provider '" + name + "' needs etl.providers." + name + ".base-url");
        }
        return builder.baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .build();
    }

    private ProviderClient providerClient(String name,
                                          EtlProperties.Provider provider,
                                          RestClient restClient,
                                          ObjectMapper objectMapper) {
        switch (name) {
            case AlphaVantageClient.PROVIDER:
                return new AlphaVantageClient(restClient, objectMapper, requireApiKey(name, provider),
                        provider.getFunctions().isEmpty() ? AlphaVantageClient.DEFAULT_FUNCTIONS : provider.getFunctions());
            case FredClient.PROVIDER:
                return new FredClient(restClient, objectMapper, requireApiKey(name, provider));
            case YahooFinanceClient.PROVIDER:
                return new YahooFinanceClient(restClient, objectMapper);
            default:
                throw new ConfigurationException("Unknown provider '" + name + "'");
        }
    }

    private String requireApiKey(String name, EtlProperties.Provider provider) {
        if (provider.getApiKey() == null || provider.getApiKey().isBlank()) {
            throw new ConfigurationException("Provider '" + name + "' is enabled but has no api key");
        }
        return provider.getApiKey();
    }
}
