package com.work.oracle.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CampaignIdTest {

    private static final String HEX = "0x00000000000000000000000000000000000000000000000000000000000000ff";

    @Test
    public void parses_bytes32_hex_with_or_without_prefix() {
        CampaignId a = CampaignId.parse(HEX, CampaignIdType.BYTES32);
        CampaignId b = CampaignId.parse(HEX.substring(2), CampaignIdType.BYTES32);

        assertEquals(a, b);
        assertEquals(HEX, a.toString());
        assertEquals(BigInteger.valueOf(255), a.toUint());
    }

    @Test
    public void parses_uint_decimal_and_hex() {
        CampaignId dec = CampaignId.parse("255", CampaignIdType.UINT256);
        CampaignId hex = CampaignId.parse("0xff", CampaignIdType.UINT256);

        assertEquals(dec, hex);
        assertEquals("255", dec.toString());
        byte[] raw = dec.toBytes();
        assertEquals(32, raw.length);
        assertEquals((byte) 0xff, raw[31]);
    }

    @Test
    public void same_bytes_with_different_encoding_are_distinct() {
        assertNotEquals(CampaignId.parse(HEX, CampaignIdType.BYTES32), CampaignId.parse("255", CampaignIdType.UINT256));
    }

    @Test
    public void max_uint256_fits() {
        BigInteger max = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
        byte[] raw = CampaignId.ofUint(max).toBytes();
        byte[] expected = new byte[32];
        Arrays.fill(expected, (byte) 0xff);
        assertArrayEquals(expected, raw);
    }

    @Test
    public void bytes32_hex_is_case_insensitive_and_printed_lower_case() {
        String upper = "0xAB" + HEX.substring(4).toUpperCase();
        CampaignId id = CampaignId.parse(upper, CampaignIdType.BYTES32);

        assertEquals(upper.toLowerCase(), id.toHex());
        assertEquals((byte) 0xab, id.toBytes()[0]);
    }

    @Test
    public void bytes32_with_non_hex_characters_is_rejected() {
        String bad = HEX.substring(0, HEX.length() - 2) + "zz";
        assertThrows(IllegalArgumentException.class, () -> CampaignId.parse(bad, CampaignIdType.BYTES32));
    }

    @Test
    public void rejects_malformed_ids() {
        assertThrows(IllegalArgumentException.class, () -> CampaignId.parse("0x1234", CampaignIdType.BYTES32));
        assertThrows(IllegalArgumentException.class, () -> CampaignId.parse("abc", CampaignIdType.UINT256));
        assertThrows(IllegalArgumentException.class, () -> CampaignId.parse("-1", CampaignIdType.UINT256));
        assertThrows(IllegalArgumentException.class, () -> CampaignId.ofUint(BigInteger.ONE.shiftLeft(256)));
    }

    @Test
    public void unknown_status_ordinal_is_rejected() {
        assertEquals(CampaignStatus.DISCARDED, CampaignStatus.fromOrdinal(4));
        assertThrows(IllegalArgumentException.class, () -> CampaignStatus.fromOrdinal(5));
    }
}
