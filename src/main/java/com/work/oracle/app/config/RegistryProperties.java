package com.work.oracle.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 外部 campaign 登记处（REST）配置，仅在 settlement.campaign-source=REGISTRY 时必填。
 */
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {

    /**
     * 例如 https://api.example.com/v1
     */
    private String baseUrl;

    /**
     * 请求头 x-api-key
     */
    private String apiKey;

    /**
     * 请求头 source
     */
    private String source = "oracle";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);

    /**
     * discard 成功后是否回写 update-campaign
     */
    private boolean notifyDiscards = true;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public boolean isNotifyDiscards() {
        return notifyDiscards;
    }

    public void setNotifyDiscards(boolean notifyDiscards) {
        this.notifyDiscards = notifyDiscards;
    }
}
