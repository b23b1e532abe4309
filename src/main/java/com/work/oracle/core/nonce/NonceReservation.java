package com.work.oracle.core.nonce;

/**
 * 一段需要依次提交的 nonce。第 k 个 nonce 只能在第 k-1 个确认（或释放）之后领取。
 * <p>
 * 非线程安全：只在账户串行队列内部使用。
 */
public class NonceReservation {

    private final NonceSequencer sequencer;
    private final int count;
    private int taken;
    private long current = -1L;

    NonceReservation(NonceSequencer sequencer, int count) {
        this.sequencer = sequencer;
        this.count = count;
    }

    public long next() {
        if (taken >= count) {
            throw new IllegalStateException("reservation exhausted: count=" + count);
        }
        if (current >= 0) {
            throw new IllegalStateException("previous nonce " + current + " not confirmed yet");
        }
        current = sequencer.next();
        taken++;
        return current;
    }

    public void confirm(long nonce) {
        sequencer.confirm(nonce);
        current = -1L;
    }

    public void release(long nonce) {
        sequencer.release(nonce);
        current = -1L;
    }

    public int remaining() {
        return count - taken;
    }
}
