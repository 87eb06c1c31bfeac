package com.investbyyourself.etl.config;

import com.investbyyourself.etl.model.BackendKind;
import com.investbyyourself.etl.service.ContentHashingService;
import com.investbyyourself.etl.service.RecordJsonCodec;
import com.investbyyourself.etl.service.loader.CacheStorageBackend;
import com.investbyyourself.etl.service.loader.FileArchiveBackend;
import com.investbyyourself.etl.service.loader.RelationalStorageBackend;
import com.investbyyourself.etl.service.loader.StorageBackend;
import com.investbyyourself.etl.service.loader.StrategyPlanner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Storage backends. The relational one is always present; the archive and cache
 * backends can be switched off with {@code etl.archive.enabled} / {@code etl.cache.enabled}.
 */
@Configuration
public class LoaderConfig {

    @Bean
    public StorageBackend relationalStorageBackend(JdbcTemplate jdbcTemplate,
                                                   PlatformTransactionManager transactionManager,
                                                   StrategyPlanner planner,
                                                   RecordJsonCodec codec,
                                                   EtlProperties properties,
                                                   Clock clock) {
        return new RelationalStorageBackend(jdbcTemplate, new TransactionTemplate(transactionManager), planner,
                codec, properties.getLoader().batchSizeFor(BackendKind.RELATIONAL), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "etl.archive", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StorageBackend fileArchiveBackend(StrategyPlanner planner,
                                             ContentHashingService hashingService,
                                             RecordJsonCodec codec,
                                             EtlProperties properties,
                                             Clock clock) {
        return new FileArchiveBackend(properties.getArchive().getRoot(), properties.getArchive().isCompression(),
                properties.getLoader().batchSizeFor(BackendKind.FILE_ARCHIVE), planner, hashingService, codec,
                clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "etl.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StorageBackend cacheStorageBackend(StringRedisTemplate redisTemplate,
                                              StrategyPlanner planner,
                                              ContentHashingService hashingService,
                                              RecordJsonCodec codec,
                                              EtlProperties properties,
                                              Clock clock) {
        return new CacheStorageBackend(redisTemplate, planner, hashingService, codec,
                properties.getCache().getKeyPrefix(), properties.getCache().getTtl(),
                properties.getLoader().batchSizeFor(BackendKind.CACHE), clock);
    }
}
