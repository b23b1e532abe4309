package com.work.oracle.app.config;

import com.work.oracle.app.chain.web3j.Web3jChainClient;
import com.work.oracle.core.chain.ChainClient;
import com.work.oracle.core.model.SettlementAccount;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。结算账户地址由私钥推导，不单独配置。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        OracleConfigValidator.validateChain(properties);
        OkHttpClient http = new OkHttpClient.Builder()
                .connectTimeout(properties.getRequestTimeout())
                .readTimeout(properties.getRequestTimeout())
                .build();
        return Web3j.build(new HttpService(properties.getRpcUrl(), http));
    }

    @Bean
    public Credentials settlementCredentials(ChainProperties properties) {
        OracleConfigValidator.validateChain(properties);
        return Credentials.create(properties.getPrivateKey().trim());
    }

    @Bean
    public SettlementAccount settlementAccount(Credentials credentials) {
        return new SettlementAccount(credentials.getAddress());
    }

    @Bean
    public ChainClient web3jChainClient(Web3j web3j, Credentials credentials, ChainProperties properties) {
        long pollMs = properties.getReceiptPollInterval().toMillis();
        int attempts = (int) Math.max(1, properties.getReceiptTimeout().toMillis() / pollMs);
        return new Web3jChainClient(web3j, credentials, properties.getChainId(),
                properties.getMarketplaceAddress().trim(), properties.getTokenAddress().trim(),
                properties.getCampaignIdType(),
                new PollingTransactionReceiptProcessor(web3j, pollMs, attempts));
    }
}
