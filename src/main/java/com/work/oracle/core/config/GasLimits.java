package com.work.oracle.core.config;

import com.work.oracle.core.model.CallKind;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;

import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 按调用类型固定的 gas 上限（保守静态预算，不做动态估算）。
 */
public class GasLimits {

    public static final BigInteger DEFAULT_TRANSITION = BigInteger.valueOf(100_000L);
    public static final BigInteger DEFAULT_FULFIL = BigInteger.valueOf(200_000L);
    public static final BigInteger DEFAULT_TRANSFER = BigInteger.valueOf(100_000L);

    private final Map<CallKind, BigInteger> limits;

    public GasLimits(Map<CallKind, BigInteger> overrides) {
        Map<CallKind, BigInteger> m = new EnumMap<>(CallKind.class);
        m.put(CallKind.ACCEPT_PROJECT_CAMPAIGN, DEFAULT_TRANSITION);
        m.put(CallKind.DISCARD_CAMPAIGN, DEFAULT_TRANSITION);
        m.put(CallKind.UNFULFILL_CAMPAIGN, DEFAULT_TRANSITION);
        m.put(CallKind.FULFIL_PROJECT_CAMPAIGN, DEFAULT_FULFIL);
        m.put(CallKind.TRANSFER, DEFAULT_TRANSFER);
        if (overrides != null) {
            for (Map.Entry<CallKind, BigInteger> e : overrides.entrySet()) {
                BigInteger v = requireNonNull(e.getValue(), "gasLimit." + e.getKey());
                if (v.signum() <= 0) {
                    throw new IllegalArgumentException("gasLimit." + e.getKey() + " 必须大于0");
                }
                m.put(e.getKey(), v);
            }
        }
        this.limits = m;
    }

    public static GasLimits defaults() {
        return new GasLimits(null);
    }

    public BigInteger forCall(CallKind kind) {
        return limits.get(requireNonNull(kind, "kind"));
    }
}
