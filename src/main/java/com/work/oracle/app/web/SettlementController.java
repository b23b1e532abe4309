package com.work.oracle.app.web;

import com.work.oracle.app.config.SettlementProperties;
import com.work.oracle.app.web.dto.AnomalyView;
import com.work.oracle.app.web.dto.ApiError;
import com.work.oracle.app.web.dto.PassReportView;
import com.work.oracle.app.web.dto.SettlementStatusView;
import com.work.oracle.core.SettlementEngine;
import com.work.oracle.core.model.PassReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 轮询相关运维接口：手动触发一轮、查看状态、查看部分结算记录。
 */
@RestController
@RequestMapping("/api/settlement")
public class SettlementController {

    private final SettlementEngine engine;
    private final SettlementProperties properties;

    public SettlementController(SettlementEngine engine, SettlementProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    /**
     * 已有一轮在执行时返回 409，不排队。
     */
    @PostMapping("/passes")
    public ResponseEntity<?> triggerPass() {
        PassReport report = engine.runPass();
        if (report.isSkipped()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new ApiError("PASS_RUNNING", "a settlement pass is already running", false));
        }
        return ResponseEntity.ok(PassReportView.of(report));
    }

    @GetMapping("/status")
    public ResponseEntity<SettlementStatusView> status() {
        return ResponseEntity.ok(new SettlementStatusView(
                engine.getState().name(),
                engine.getAccount().getAddress(),
                properties.isEnabled(),
                PassReportView.of(engine.getLastReport())));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<List<AnomalyView>> anomalies(@RequestParam(name = "limit", defaultValue = "100") int limit) {
        List<AnomalyView> views = engine.recentAnomalies(Math.max(1, limit)).stream()
                .map(AnomalyView::of)
                .collect(Collectors.toList());
        return ResponseEntity.ok(views);
    }
}
