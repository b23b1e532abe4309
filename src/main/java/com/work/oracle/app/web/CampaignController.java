package com.work.oracle.app.web;

import com.work.oracle.app.config.ChainProperties;
import com.work.oracle.app.web.dto.EvaluationView;
import com.work.oracle.app.web.dto.OutcomeView;
import com.work.oracle.core.SettlementEngine;
import com.work.oracle.core.model.CampaignId;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 单个 campaign 的运维接口：只读评估、管理员 accept。
 * id 按 chain.campaign-id-type 解析（bytes32 为 0x 开头的 64 位十六进制，uint256 为十进制）。
 */
@RestController
@RequestMapping("/api/campaigns")
public class CampaignController {

    private final SettlementEngine engine;
    private final ChainProperties chainProperties;

    public CampaignController(SettlementEngine engine, ChainProperties chainProperties) {
        this.engine = engine;
        this.chainProperties = chainProperties;
    }

    @GetMapping("/{campaignId}/evaluation")
    public ResponseEntity<EvaluationView> evaluate(@PathVariable String campaignId) {
        return ResponseEntity.ok(EvaluationView.of(engine.evaluate(parse(campaignId))));
    }

    @PostMapping("/{campaignId}/accept")
    public ResponseEntity<OutcomeView> accept(@PathVariable String campaignId) {
        return ResponseEntity.ok(OutcomeView.of(engine.acceptCampaign(parse(campaignId))));
    }

    private CampaignId parse(String campaignId) {
        return CampaignId.parse(campaignId, chainProperties.getCampaignIdType());
    }
}
