package com.work.oracle.core.chain;

import com.work.oracle.core.exception.ReadException;
import com.work.oracle.core.exception.SourceUnavailableException;
import com.work.oracle.core.model.CampaignId;

import java.util.List;

import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 直接通过合约枚举 campaign id。
 */
public class ChainCampaignSource implements CampaignSource {

    private final ChainClient chainClient;

    public ChainCampaignSource(ChainClient chainClient) {
        this.chainClient = requireNonNull(chainClient, "chainClient");
    }

    @Override
    public List<CampaignId> listCampaignIds() {
        List<CampaignId> ids;
        try {
            ids = chainClient.getAllCampaigns();
        } catch (ReadException e) {
            throw new SourceUnavailableException("getAllCampaigns failed: " + e.getMessage(), e);
        }
        if (ids == null) {
            throw new SourceUnavailableException("getAllCampaigns returned null");
        }
        return ids;
    }
}
