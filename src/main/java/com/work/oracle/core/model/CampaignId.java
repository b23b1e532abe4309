package com.work.oracle.core.model;

import java.math.BigInteger;
import java.util.Arrays;

import static com.work.oracle.core.support.ValidationUtils.requireNonEmpty;
import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * campaign 标识。内部统一存为 32 字节大端序，按 {@link CampaignIdType} 决定对外的 ABI 类型与文本形式。
 */
public final class CampaignId {

    public static final int LENGTH = 32;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final CampaignIdType type;
    private final byte[] value;

    private CampaignId(CampaignIdType type, byte[] value) {
        this.type = type;
        this.value = value;
    }

    public static CampaignId ofBytes32(byte[] raw) {
        requireNonNull(raw, "raw");
        if (raw.length != LENGTH) {
            throw new IllegalArgumentException("bytes32 campaign id 长度必须为 32, actual=" + raw.length);
        }
        return new CampaignId(CampaignIdType.BYTES32, raw.clone());
    }

    public static CampaignId ofUint(BigInteger handle) {
        requireNonNull(handle, "handle");
        if (handle.signum() < 0 || handle.bitLength() > LENGTH * 8) {
            throw new IllegalArgumentException("uint256 campaign id 超出范围: " + handle);
        }
        byte[] raw = new byte[LENGTH];
        byte[] be = handle.toByteArray();
        // toByteArray 可能带一个符号位前导 0
        int srcPos = be.length > LENGTH ? be.length - LENGTH : 0;
        int len = be.length - srcPos;
        System.arraycopy(be, srcPos, raw, LENGTH - len, len);
        return new CampaignId(CampaignIdType.UINT256, raw);
    }

    /**
     * 按给定编码方式解析文本形式的 id。
     */
    public static CampaignId parse(String text, CampaignIdType type) {
        requireNonEmpty(text, "campaignId");
        requireNonNull(type, "type");
        String t = text.trim();
        try {
            if (type == CampaignIdType.BYTES32) {
                String hex = t.startsWith("0x") || t.startsWith("0X") ? t.substring(2) : t;
                if (hex.length() != LENGTH * 2) {
                    throw new IllegalArgumentException("bytes32 campaign id 必须为 64 位十六进制: " + text);
                }
                return ofBytes32(parseHex(hex, text));
            }
            if (t.startsWith("0x") || t.startsWith("0X")) {
                return ofUint(new BigInteger(t.substring(2), 16));
            }
            return ofUint(new BigInteger(t));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("无法解析 campaign id: " + text, e);
        }
    }

    private static byte[] parseHex(String hex, String original) {
        byte[] out = new byte[hex.length() / 2];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(hex.charAt(2 * i), 16);
            int lo = Character.digit(hex.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("bytes32 campaign id 含非十六进制字符: " + original);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    public CampaignIdType getType() {
        return type;
    }

    public byte[] toBytes() {
        return value.clone();
    }

    public BigInteger toUint() {
        return new BigInteger(1, value);
    }

    public String toHex() {
        StringBuilder sb = new StringBuilder(2 + value.length * 2).append("0x");
        for (byte b : value) {
            sb.append(HEX[(b >> 4) & 0xf]).append(HEX[b & 0xf]);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CampaignId)) return false;
        CampaignId that = (CampaignId) o;
        return type == that.type && Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return type == CampaignIdType.BYTES32 ? toHex() : toUint().toString();
    }
}
