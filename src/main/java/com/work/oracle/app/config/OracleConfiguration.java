package com.work.oracle.app.config;

import com.work.oracle.app.registry.RegistryCampaignClient;
import com.work.oracle.core.SettlementEngine;
import com.work.oracle.core.anomaly.AnomalyJournal;
import com.work.oracle.core.anomaly.InMemoryAnomalyJournal;
import com.work.oracle.core.chain.CampaignSource;
import com.work.oracle.core.chain.CampaignStatusNotifier;
import com.work.oracle.core.chain.ChainCampaignSource;
import com.work.oracle.core.chain.ChainClient;
import com.work.oracle.core.config.SettlementSettings;
import com.work.oracle.core.metrics.NoopSettlementMetrics;
import com.work.oracle.core.metrics.SettlementMetrics;
import com.work.oracle.core.model.SettlementAccount;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 将 core 组件装配为 Spring Bean。
 * ChainClient 与 SettlementAccount 由 MockChainConfiguration / Web3jConfiguration 按 chain.mode 提供。
 */
@Configuration
@EnableConfigurationProperties({ChainProperties.class, SettlementProperties.class, RegistryProperties.class})
public class OracleConfiguration {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SettlementSettings settlementSettings(SettlementProperties properties, ChainProperties chain) {
        OracleConfigValidator.validateTimeouts(chain, properties);
        return OracleConfigValidator.toSettlementSettings(properties);
    }

    @Bean
    public AnomalyJournal anomalyJournal(SettlementProperties properties) {
        return new InMemoryAnomalyJournal(properties.getAnomalyCapacity());
    }

    @Bean
    @ConditionalOnMissingBean(SettlementMetrics.class)
    public SettlementMetrics settlementMetrics() {
        return new NoopSettlementMetrics();
    }

    /**
     * 登记处客户端仅在 campaign 来源为 REGISTRY，或需要回写 discard 状态时创建。
     */
    @Bean
    public RegistryClientHolder registryClientHolder(SettlementProperties settlement,
                                                     RegistryProperties registry,
                                                     ChainProperties chain,
                                                     RestTemplateBuilder restTemplateBuilder) {
        boolean sourceFromRegistry = settlement.getCampaignSource() == CampaignSourceMode.REGISTRY;
        boolean configured = registry.getBaseUrl() != null && !registry.getBaseUrl().trim().isEmpty();
        if (!sourceFromRegistry && !configured) {
            return new RegistryClientHolder(null);
        }
        OracleConfigValidator.validateRegistry(registry);
        return new RegistryClientHolder(new RegistryCampaignClient(
                RegistryCampaignClient.buildRestTemplate(restTemplateBuilder, registry),
                chain.getCampaignIdType(),
                registry.isNotifyDiscards()));
    }

    @Bean
    public CampaignSource campaignSource(SettlementProperties settlement,
                                         RegistryClientHolder registry,
                                         ChainClient chainClient) {
        if (settlement.getCampaignSource() == CampaignSourceMode.REGISTRY) {
            return registry.get();
        }
        return new ChainCampaignSource(chainClient);
    }

    @Bean
    public CampaignStatusNotifier campaignStatusNotifier(RegistryClientHolder registry) {
        return registry.get() != null ? registry.get() : CampaignStatusNotifier.noop();
    }

    @Bean(destroyMethod = "close")
    public SettlementEngine settlementEngine(ChainClient chainClient,
                                             CampaignSource campaignSource,
                                             SettlementAccount account,
                                             SettlementSettings settings,
                                             AnomalyJournal anomalyJournal,
                                             CampaignStatusNotifier notifier,
                                             ObjectProvider<SettlementMetrics> metrics,
                                             Clock clock) {
        return new SettlementEngine(chainClient, campaignSource, account, settings, anomalyJournal,
                notifier, metrics.getIfAvailable(NoopSettlementMetrics::new), clock);
    }

    /**
     * 可空的登记处客户端（Spring 不允许 @Bean 方法返回 null 作为普通依赖）。
     */
    public static class RegistryClientHolder {
        private final RegistryCampaignClient client;

        RegistryClientHolder(RegistryCampaignClient client) {
            this.client = client;
        }

        public RegistryCampaignClient get() {
            return client;
        }
    }
}
