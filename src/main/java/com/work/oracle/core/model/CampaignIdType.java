package com.work.oracle.core.model;

/**
 * 合约侧 campaign 标识的编码方式。
 */
public enum CampaignIdType {

    /**
     * 原始 32 字节标识（bytes32），文本形式为 0x 开头的十六进制。
     */
    BYTES32,

    /**
     * 整数句柄（uint256），文本形式为十进制。
     */
    UINT256
}
