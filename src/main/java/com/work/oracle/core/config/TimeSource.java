package com.work.oracle.core.config;

/**
 * “当前时间”的来源。
 */
public enum TimeSource {

    /**
     * 本机时钟。
     */
    WALL_CLOCK,

    /**
     * 最新区块时间戳（与合约内 block.timestamp 的判断口径一致）。
     */
    LATEST_BLOCK
}
