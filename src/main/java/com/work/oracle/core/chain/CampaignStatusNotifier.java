package com.work.oracle.core.chain;

import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.CampaignStatus;

/**
 * 结算完成后向外部登记处回写状态（可选）。失败不影响已上链的结算结果。
 */
public interface CampaignStatusNotifier {

    void campaignSettled(CampaignId campaignId, CampaignStatus status);

    static CampaignStatusNotifier noop() {
        return (campaignId, status) -> {
        };
    }
}
