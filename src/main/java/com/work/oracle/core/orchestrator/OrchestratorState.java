package com.work.oracle.core.orchestrator;

/**
 * 编排器状态：IDLE（两轮之间休眠）/ POLLING（本轮处理中）。
 */
public enum OrchestratorState {
    IDLE,
    POLLING
}
