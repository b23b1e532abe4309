package com.work.oracle.core.execution;

import java.util.concurrent.Callable;

/**
 * 统一的“按账户执行”入口。
 *
 * 设计目标：
 * - 同一账户的提交工作被串行化，形成提交+确认的严格全序（nonce 正确性的前提）
 * - 评估/读取可以并行，只有提交需要经过这里
 */
public interface AccountExecutor {

    <T> T execute(String account, Callable<T> work);
}
