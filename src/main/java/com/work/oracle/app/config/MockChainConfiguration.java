package com.work.oracle.app.config;

import com.work.oracle.app.chain.InMemoryChainClient;
import com.work.oracle.core.model.SettlementAccount;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * mock 装配（默认）：进程内模拟合约，不连接任何节点。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class MockChainConfiguration {

    @Bean
    public SettlementAccount settlementAccount(ChainProperties properties) {
        OracleConfigValidator.validateChain(properties);
        return new SettlementAccount(properties.getAccountAddress());
    }

    @Bean
    public InMemoryChainClient inMemoryChainClient(SettlementAccount account, Clock clock) {
        return new InMemoryChainClient(account.getAddress(), clock);
    }
}
