package com.work.oracle.core;

import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.CampaignStatus;

import java.math.BigInteger;

/**
 * 测试用 campaign 构造器。
 */
public final class TestCampaigns {

    public static final String ORACLE = "0x00000000000000000000000000000000000000a1";
    public static final String CREATOR = "0x00000000000000000000000000000000000000c1";
    public static final String KOL = "0x00000000000000000000000000000000000000b1";

    private TestCampaigns() {
    }

    public static CampaignId id(long n) {
        return CampaignId.ofUint(BigInteger.valueOf(n));
    }

    public static Campaign campaign(long id, CampaignStatus status, long offerDeadline, long promotionDeadline, long amount) {
        return new Campaign(id(id), CREATOR, KOL,
                BigInteger.valueOf(offerDeadline),
                BigInteger.valueOf(promotionDeadline),
                BigInteger.valueOf(amount),
                status);
    }
}
