package com.work.oracle.core.orchestrator;

import com.work.oracle.app.chain.InMemoryChainClient;
import com.work.oracle.core.anomaly.InMemoryAnomalyJournal;
import com.work.oracle.core.chain.CampaignSource;
import com.work.oracle.core.chain.CampaignStatusNotifier;
import com.work.oracle.core.chain.ChainCampaignSource;
import com.work.oracle.core.config.DeadlineUnit;
import com.work.oracle.core.config.GasLimits;
import com.work.oracle.core.config.TimeSource;
import com.work.oracle.core.evaluate.CurrentTimeResolver;
import com.work.oracle.core.evaluate.SettlementEvaluator;
import com.work.oracle.core.exception.ErrorKind;
import com.work.oracle.core.exception.SourceUnavailableException;
import com.work.oracle.core.execution.SettlementExecutor;
import com.work.oracle.core.execution.WorkerQueueAccountExecutor;
import com.work.oracle.core.metrics.SettlementMetrics;
import com.work.oracle.core.model.CallKind;
import com.work.oracle.core.model.CampaignStatus;
import com.work.oracle.core.model.PassReport;
import com.work.oracle.core.nonce.NonceSequencer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.work.oracle.core.TestCampaigns.ORACLE;
import static com.work.oracle.core.TestCampaigns.campaign;
import static com.work.oracle.core.TestCampaigns.id;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SettlementOrchestratorTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_000), ZoneOffset.UTC);
    private final InMemoryChainClient chain = new InMemoryChainClient(ORACLE, clock);
    private final WorkerQueueAccountExecutor accountExecutor =
            new WorkerQueueAccountExecutor(16, Duration.ofSeconds(10), "test-submitter-");
    private final SettlementMetrics metrics = mock(SettlementMetrics.class);

    @AfterEach
    public void tearDown() {
        accountExecutor.close();
    }

    private SettlementOrchestrator orchestrator(CampaignSource source, int parallelism) {
        SettlementEvaluator evaluator = new SettlementEvaluator(new BigDecimal("0.9"), DeadlineUnit.SECONDS, true);
        SettlementExecutor executor = new SettlementExecutor(chain, new NonceSequencer(chain, ORACLE), accountExecutor,
                evaluator, GasLimits.defaults(), new InMemoryAnomalyJournal(10), CampaignStatusNotifier.noop(), metrics, clock);
        return new SettlementOrchestrator(source, chain, evaluator, executor,
                new CurrentTimeResolver(TimeSource.WALL_CLOCK, clock, chain), metrics, clock, parallelism);
    }

    @Test
    public void one_failing_campaign_does_not_stop_the_others() {
        chain.putCampaign(campaign(1, CampaignStatus.OPEN, 900, 2_000, 10));
        chain.putCampaign(campaign(2, CampaignStatus.OPEN, 900, 2_000, 20));
        chain.putCampaign(campaign(3, CampaignStatus.OPEN, 900, 2_000, 30));
        chain.failReads(id(2));

        PassReport report = orchestrator(new ChainCampaignSource(chain), 1).runPass();

        assertEquals(3, report.getCampaignCount());
        assertEquals(2, report.getExecuted().size());
        assertEquals(1, report.getFailures().size());
        assertEquals(id(2), report.getFailures().get(0).getCampaignId());
        assertEquals(ErrorKind.READ, report.getFailures().get(0).getKind());
        assertEquals(CampaignStatus.DISCARDED, chain.getCampaignInfo(id(1)).getStatus());
        assertEquals(CampaignStatus.DISCARDED, chain.getCampaignInfo(id(3)).getStatus());
    }

    @Test
    public void failed_submission_is_reported_with_last_snapshot() {
        chain.putCampaign(campaign(1, CampaignStatus.OPEN, 900, 2_000, 10));
        chain.failNextSubmission(CallKind.DISCARD_CAMPAIGN);

        PassReport report = orchestrator(new ChainCampaignSource(chain), 1).runPass();

        assertEquals(1, report.getFailures().size());
        assertEquals(ErrorKind.SUBMISSION, report.getFailures().get(0).getKind());
        assertEquals(CampaignStatus.OPEN, report.getFailures().get(0).getSnapshot().getStatus());
        verify(metrics).campaignFailed("SUBMISSION");
    }

    @Test
    public void empty_campaign_list_completes_with_no_actions() {
        PassReport report = orchestrator(Collections::emptyList, 1).runPass();

        assertEquals(0, report.getCampaignCount());
        assertTrue(report.getExecuted().isEmpty());
        assertTrue(chain.getMined().isEmpty());
    }

    @Test
    public void unavailable_source_fails_the_pass() {
        chain.setEnumerationFailing(true);
        SettlementOrchestrator o = orchestrator(new ChainCampaignSource(chain), 1);

        assertThrows(SourceUnavailableException.class, o::runPass);
        assertEquals(OrchestratorState.IDLE, o.getState());
        assertNull(o.getLastReport());
        verify(metrics).sourceUnavailable();
    }

    @Test
    public void terminal_campaigns_are_left_alone() {
        chain.putCampaign(campaign(1, CampaignStatus.FULFILLED, 0, 0, 10));
        chain.putCampaign(campaign(2, CampaignStatus.DISCARDED, 0, 0, 10));

        PassReport report = orchestrator(new ChainCampaignSource(chain), 1).runPass();

        assertTrue(report.getExecuted().isEmpty());
        assertTrue(report.getFailures().isEmpty());
        assertTrue(chain.getMined().isEmpty());
    }

    @Test
    public void parallel_evaluation_still_serialises_nonces() {
        for (int i = 1; i <= 6; i++) {
            chain.putCampaign(campaign(i, CampaignStatus.OPEN, 900, 2_000, i));
        }
        SettlementOrchestrator o = orchestrator(new ChainCampaignSource(chain), 4);
        try {
            PassReport report = o.runPass();

            assertEquals(6, report.getExecuted().size());
            assertEquals(12, chain.getMined().size());
            for (int i = 0; i < 12; i++) {
                assertEquals(i, chain.getMined().get(i).getNonce());
                assertTrue(chain.getMined().get(i).getReceipt().isSuccess());
            }
        } finally {
            o.close();
        }
    }

    @Test
    public void overlapping_pass_is_skipped() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CampaignSource blocking = () -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Collections.emptyList();
        };
        SettlementOrchestrator o = orchestrator(blocking, 1);

        Thread t = new Thread(o::runPass);
        t.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        assertEquals(OrchestratorState.POLLING, o.getState());

        PassReport second = o.runPass();
        assertTrue(second.isSkipped());

        release.countDown();
        t.join(5_000);
        assertEquals(OrchestratorState.IDLE, o.getState());
    }

    @Test
    public void last_report_is_kept() {
        CampaignSource source = mock(CampaignSource.class);
        when(source.listCampaignIds()).thenReturn(Collections.emptyList());
        SettlementOrchestrator o = orchestrator(source, 1);

        PassReport report = o.runPass();

        assertSame(report, o.getLastReport());
    }
}
