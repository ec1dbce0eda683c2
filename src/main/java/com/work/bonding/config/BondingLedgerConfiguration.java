package com.work.bonding.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.bonding.core.config.BondingConfig;
import com.work.bonding.core.execution.LedgerOperationExecutor;
import com.work.bonding.core.identity.BondIdentity;
import com.work.bonding.core.lock.LedgerLockManager;
import com.work.bonding.core.lock.impl.RedisLedgerLockManager;
import com.work.bonding.core.repository.LedgerEventLog;
import com.work.bonding.core.repository.LedgerRepository;
import com.work.bonding.core.repository.impl.PostgresLedgerEventLog;
import com.work.bonding.core.repository.impl.PostgresLedgerRepository;
import com.work.bonding.core.repository.mapper.BondStateMapper;
import com.work.bonding.core.repository.mapper.LedgerEventMapper;
import com.work.bonding.core.repository.mapper.PoolSlashPointsMapper;
import com.work.bonding.core.support.InMemoryLedgerEventLog;
import com.work.bonding.core.support.InMemoryLedgerLockManager;
import com.work.bonding.core.support.InMemoryLedgerRepository;
import com.work.bonding.core.support.InMemoryTokenLedger;
import com.work.bonding.core.support.InMemoryTransactionManager;
import com.work.bonding.core.support.metrics.LedgerMetrics;
import com.work.bonding.core.support.metrics.NoopLedgerMetrics;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * 将账本核心组件装配为 Spring Bean。
 * 生产环境使用 PostgreSQL + Redis；bonding.storage / bonding.lock-mode 设为 memory 时可脱离外部依赖单进程运行。
 */
@Configuration
@EnableConfigurationProperties({BondingProperties.class, ChainProperties.class})
public class BondingLedgerConfiguration {

    @Bean
    public BondingConfig bondingConfig(BondingProperties properties) {
        return new BondingConfig(
                properties.getTokenAddress(),
                properties.getAuthorityAddress(),
                properties.getInstanceAddress(),
                properties.getLockTtl(),
                properties.getLockWait(),
                properties.getNodeId(),
                properties.getTransactionTimeout()
        );
    }

    /**
     * 账本唯一的时间来源，测试或回放时可替换。
     */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(LedgerMetrics.class)
    public LedgerMetrics ledgerMetrics() {
        return new NoopLedgerMetrics();
    }

    @Bean
    public BondIdentity bondIdentity(BondingConfig config) {
        return new BondIdentity(config.getInstanceAddress());
    }

    @Bean
    public LedgerOperationExecutor ledgerOperationExecutor(LedgerLockManager lockManager,
                                                           BondingConfig config,
                                                           Clock clock,
                                                           LedgerMetrics metrics,
                                                           PlatformTransactionManager transactionManager) {
        return new LedgerOperationExecutor(lockManager, config, clock, metrics, transactionManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public InMemoryTokenLedger inMemoryTokenLedger(BondingConfig config) {
        return new InMemoryTokenLedger(config.getInstanceAddress());
    }

    @Configuration
    @ConditionalOnProperty(prefix = "bonding", name = "storage", havingValue = "postgres", matchIfMissing = true)
    @MapperScan("com.work.bonding.core.repository.mapper")
    static class PostgresStorageConfiguration {

        @Bean
        public LedgerRepository postgresLedgerRepository(PoolSlashPointsMapper slashPointsMapper,
                                                         BondStateMapper bondStateMapper) {
            return new PostgresLedgerRepository(slashPointsMapper, bondStateMapper);
        }

        @Bean
        public LedgerEventLog postgresLedgerEventLog(LedgerEventMapper eventMapper, ObjectMapper objectMapper) {
            return new PostgresLedgerEventLog(eventMapper, objectMapper);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "bonding", name = "storage", havingValue = "memory")
    static class InMemoryStorageConfiguration {

        @Bean
        public LedgerRepository inMemoryLedgerRepository() {
            return new InMemoryLedgerRepository();
        }

        @Bean
        public LedgerEventLog inMemoryLedgerEventLog() {
            return new InMemoryLedgerEventLog();
        }

        @Bean
        public PlatformTransactionManager transactionManager() {
            return new InMemoryTransactionManager();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "bonding", name = "lock-mode", havingValue = "redis", matchIfMissing = true)
    static class RedisLockConfiguration {

        @Bean
        public LedgerLockManager redisLedgerLockManager(StringRedisTemplate redisTemplate) {
            return new RedisLedgerLockManager(redisTemplate);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "bonding", name = "lock-mode", havingValue = "memory")
    static class InMemoryLockConfiguration {

        @Bean
        public LedgerLockManager inMemoryLedgerLockManager() {
            return new InMemoryLedgerLockManager();
        }
    }
}
