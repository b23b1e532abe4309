package com.work.oracle.app.config;

import com.work.oracle.core.config.GasLimits;
import com.work.oracle.core.config.SettlementSettings;
import com.work.oracle.core.exception.ConfigException;
import com.work.oracle.core.model.CallKind;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.work.oracle.core.support.ValidationUtils.isAddress;

/**
 * 启动期配置校验。任何必填项缺失都是致命错误（ConfigException），不做运行时重试。
 * <p>
 * 一次性收集全部问题再抛出，避免逐项修改、逐次重启。
 */
public final class OracleConfigValidator {

    private OracleConfigValidator() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static void validateChain(ChainProperties chain) {
        List<String> problems = new ArrayList<>();
        String mode = chain.getMode();
        if (ChainProperties.MODE_WEB3J.equalsIgnoreCase(mode)) {
            requireText(problems, chain.getRpcUrl(), "chain.rpc-url");
            requireText(problems, chain.getPrivateKey(), "chain.private-key");
            requireAddressValue(problems, chain.getMarketplaceAddress(), "chain.marketplace-address");
            requireAddressValue(problems, chain.getTokenAddress(), "chain.token-address");
            if (chain.getChainId() <= 0) {
                problems.add("chain.chain-id must be > 0");
            }
            if (isNonPositive(chain.getReceiptPollInterval())) {
                problems.add("chain.receipt-poll-interval must be > 0");
            }
            if (isNonPositive(chain.getReceiptTimeout())) {
                problems.add("chain.receipt-timeout must be > 0");
            }
        } else if (ChainProperties.MODE_MOCK.equalsIgnoreCase(mode)) {
            requireAddressValue(problems, chain.getAccountAddress(), "chain.account-address");
        } else {
            problems.add("chain.mode must be 'mock' or 'web3j', got '" + mode + "'");
        }
        if (chain.getCampaignIdType() == null) {
            problems.add("chain.campaign-id-type is required");
        }
        failIfAny(problems);
    }

    public static void validateRegistry(RegistryProperties registry) {
        List<String> problems = new ArrayList<>();
        requireText(problems, registry.getBaseUrl(), "registry.base-url");
        requireText(problems, registry.getApiKey(), "registry.api-key");
        requireText(problems, registry.getSource(), "registry.source");
        failIfAny(problems);
    }

    /**
     * 账户串行队列的等待上限必须覆盖一轮内全部排队动作的两次 receipt 等待：
     * dispatch-timeout >= 2 * receipt-timeout * parallelism。mock 模式不等待 receipt，不校验。
     */
    public static void validateTimeouts(ChainProperties chain, SettlementProperties settlement) {
        if (!ChainProperties.MODE_WEB3J.equalsIgnoreCase(chain.getMode())
                || isNonPositive(chain.getReceiptTimeout())
                || settlement.getDispatchTimeout() == null) {
            return;
        }
        Duration required = chain.getReceiptTimeout()
                .multipliedBy(2L)
                .multipliedBy(Math.max(1, settlement.getParallelism()));
        if (settlement.getDispatchTimeout().compareTo(required) < 0) {
            throw new ConfigException("invalid configuration: settlement.dispatch-timeout=" + settlement.getDispatchTimeout()
                    + " must be >= 2 * chain.receipt-timeout * settlement.parallelism = " + required);
        }
    }

    /**
     * 把宿主配置转换为 core 侧的 SettlementSettings，非法取值统一转为 ConfigException。
     */
    public static SettlementSettings toSettlementSettings(SettlementProperties props) {
        List<String> problems = new ArrayList<>();
        if (props.getCampaignSource() == null) {
            problems.add("settlement.campaign-source is required");
        }
        if (props.getPollIntervalMs() <= 0) {
            problems.add("settlement.poll-interval-ms must be > 0");
        }
        failIfAny(problems);

        Map<CallKind, BigInteger> gas = new EnumMap<>(CallKind.class);
        gas.put(CallKind.ACCEPT_PROJECT_CAMPAIGN, BigInteger.valueOf(props.getGas().getTransition()));
        gas.put(CallKind.DISCARD_CAMPAIGN, BigInteger.valueOf(props.getGas().getTransition()));
        gas.put(CallKind.UNFULFILL_CAMPAIGN, BigInteger.valueOf(props.getGas().getTransition()));
        gas.put(CallKind.FULFIL_PROJECT_CAMPAIGN, BigInteger.valueOf(props.getGas().getFulfil()));
        gas.put(CallKind.TRANSFER, BigInteger.valueOf(props.getGas().getTransfer()));
        try {
            return new SettlementSettings(
                    props.getSettlementFraction(),
                    props.getDeadlineUnit(),
                    props.getTimeSource(),
                    props.isAutoFulfil(),
                    new GasLimits(gas),
                    props.getParallelism(),
                    props.getDispatchTimeout());
        } catch (IllegalArgumentException e) {
            throw new ConfigException("invalid settlement configuration: " + e.getMessage(), e);
        }
    }

    private static void requireText(List<String> problems, String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            problems.add(name + " is required");
        }
    }

    private static void requireAddressValue(List<String> problems, String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            problems.add(name + " is required");
        } else if (!isAddress(value.trim())) {
            problems.add(name + " is not a valid address: " + value);
        }
    }

    private static boolean isNonPositive(Duration d) {
        return d == null || d.isNegative() || d.isZero();
    }

    private static void failIfAny(List<String> problems) {
        if (!problems.isEmpty()) {
            throw new ConfigException("invalid configuration: " + String.join("; ", problems));
        }
    }
}
