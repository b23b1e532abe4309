package com.work.oracle.core.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；平台可通过自定义 Bean 接入具体实现。
 */
public interface SettlementMetrics {

    default void passCompleted(int campaigns, int executed, int failed) {
    }

    default void sourceUnavailable() {
    }

    default void campaignFailed(String kind) {
    }

    default void transactionSubmitted(String callKind, boolean success) {
    }

    default void partialSettlement(String actionType) {
    }
}
