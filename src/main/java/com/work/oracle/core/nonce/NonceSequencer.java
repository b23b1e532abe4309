package com.work.oracle.core.nonce;

import com.work.oracle.core.chain.ChainClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.work.oracle.core.support.ValidationUtils.requireAddress;
import static com.work.oracle.core.support.ValidationUtils.requireNonNegative;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 结算账户的 nonce 序列器：max(chain, cursor) 分配。
 * <p>
 * 约束：
 * <ul>
 *   <li>同一时刻最多一个 nonce 在途（已签发、尚未确认/释放），保证提交与确认的严格全序</li>
 *   <li>下一个 nonce 只在上一个确认后才推导：max(链上 pending count, 已确认 nonce + 1)，不预先计算</li>
 *   <li>提交失败（未打包）释放 nonce 并丢弃本地游标，下一次从链上重新推导</li>
 * </ul>
 * 调用方负责把同一账户的全部提交放进同一串行队列（见 AccountExecutor）。
 */
public class NonceSequencer {

    private static final Logger log = LoggerFactory.getLogger(NonceSequencer.class);

    private static final long NONE = -1L;

    private final ChainClient chainClient;
    private final String address;

    /**
     * 本地游标：最近一次确认的 nonce + 1；NONE 表示未知，以链上为准。
     */
    private long cursor = NONE;
    private long inFlight = NONE;

    public NonceSequencer(ChainClient chainClient, String address) {
        this.chainClient = requireNonNull(chainClient, "chainClient");
        this.address = requireAddress(address, "address");
    }

    /**
     * 预留一段需要依次提交的 nonce（例如状态迁移 + 资金划转）。
     * 具体数值在每次 {@link NonceReservation#next()} 时才推导。
     */
    public NonceReservation reserve(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count 必须大于0");
        }
        return new NonceReservation(this, count);
    }

    /**
     * 签发下一个 nonce。上一个 nonce 尚未确认/释放时拒绝签发。
     */
    public synchronized long next() {
        if (inFlight != NONE) {
            throw new IllegalStateException("nonce " + inFlight + " still in flight for " + address);
        }
        long chainNext = chainClient.accountNonce(address);
        long n = Math.max(chainNext, cursor);
        if (cursor != NONE && chainNext > cursor) {
            // 账户被外部使用过，以链上为准
            log.warn("Chain nonce ahead of local cursor. address={} chainNext={} cursor={}", address, chainNext, cursor);
        }
        inFlight = n;
        return n;
    }

    /**
     * 交易已打包（无论 receipt 成功与否，nonce 都已被链消耗）。
     */
    public synchronized void confirm(long nonce) {
        requireNonNegative(nonce, "nonce");
        requireInFlight(nonce);
        cursor = Math.max(cursor, nonce + 1);
        inFlight = NONE;
    }

    /**
     * 交易未能打包：释放 nonce，丢弃本地游标（交易可能被丢弃或替换，不能再信任本地推算）。
     */
    public synchronized void release(long nonce) {
        requireNonNegative(nonce, "nonce");
        requireInFlight(nonce);
        cursor = NONE;
        inFlight = NONE;
    }

    public String getAddress() {
        return address;
    }

    private void requireInFlight(long nonce) {
        if (inFlight != nonce) {
            throw new IllegalStateException("nonce " + nonce + " is not in flight for " + address + " (inFlight=" + inFlight + ")");
        }
    }
}
