package com.work.oracle.core.chain;

import com.work.oracle.core.model.CampaignId;

import java.util.List;

/**
 * 提供本轮需要评估的 campaign id 集合。
 * <p>
 * 失败必须抛出 {@link com.work.oracle.core.exception.SourceUnavailableException}，
 * 不允许返回空列表冒充“无事可做”。
 */
public interface CampaignSource {

    List<CampaignId> listCampaignIds();
}
