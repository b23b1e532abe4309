package com.work.oracle.app.config;

import com.work.oracle.core.model.CampaignIdType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 链连接配置。
 *
 * mode=mock: 使用 InMemoryChainClient（进程内模拟合约）
 * mode=web3j: 使用 Web3jChainClient
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    public static final String MODE_MOCK = "mock";
    public static final String MODE_WEB3J = "web3j";

    /**
     * mock 或 web3j
     */
    private String mode = MODE_MOCK;

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * EIP-155 chain id（hardhat 本地网络为 31337）
     */
    private long chainId = 31337L;

    /**
     * 结算账户私钥（web3j 模式必填，地址由私钥推导）
     */
    private String privateKey;

    /**
     * mock 模式下的结算账户地址
     */
    private String accountAddress = "0x00000000000000000000000000000000000000a1";

    /**
     * marketplace 合约地址
     */
    private String marketplaceAddress;

    /**
     * 结算代币（USDC）合约地址
     */
    private String tokenAddress;

    /**
     * campaign id 的 ABI 类型
     */
    private CampaignIdType campaignIdType = CampaignIdType.BYTES32;

    /**
     * 等待打包时查询 receipt 的间隔
     */
    private Duration receiptPollInterval = Duration.ofSeconds(1);

    /**
     * 等待打包的最长时间，超时按提交失败处理
     */
    private Duration receiptTimeout = Duration.ofMinutes(2);

    /**
     * 单次 RPC 请求超时
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public long getChainId() {
        return chainId;
    }

    public void setChainId(long chainId) {
        this.chainId = chainId;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public String getAccountAddress() {
        return accountAddress;
    }

    public void setAccountAddress(String accountAddress) {
        this.accountAddress = accountAddress;
    }

    public String getMarketplaceAddress() {
        return marketplaceAddress;
    }

    public void setMarketplaceAddress(String marketplaceAddress) {
        this.marketplaceAddress = marketplaceAddress;
    }

    public String getTokenAddress() {
        return tokenAddress;
    }

    public void setTokenAddress(String tokenAddress) {
        this.tokenAddress = tokenAddress;
    }

    public CampaignIdType getCampaignIdType() {
        return campaignIdType;
    }

    public void setCampaignIdType(CampaignIdType campaignIdType) {
        this.campaignIdType = campaignIdType;
    }

    public Duration getReceiptPollInterval() {
        return receiptPollInterval;
    }

    public void setReceiptPollInterval(Duration receiptPollInterval) {
        this.receiptPollInterval = receiptPollInterval;
    }

    public Duration getReceiptTimeout() {
        return receiptTimeout;
    }

    public void setReceiptTimeout(Duration receiptTimeout) {
        this.receiptTimeout = receiptTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
