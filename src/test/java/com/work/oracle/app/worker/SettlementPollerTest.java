package com.work.oracle.app.worker;

import com.work.oracle.app.config.SettlementProperties;
import com.work.oracle.core.SettlementEngine;
import com.work.oracle.core.exception.SourceUnavailableException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SettlementPollerTest {

    @Test
    public void disabled_poller_does_nothing() {
        SettlementEngine engine = mock(SettlementEngine.class);
        SettlementProperties props = new SettlementProperties();
        props.setEnabled(false);

        new SettlementPoller(engine, props).poll();

        verify(engine, never()).runPass();
    }

    @Test
    public void source_outage_is_survived_and_retried_next_tick() {
        SettlementEngine engine = mock(SettlementEngine.class);
        when(engine.runPass()).thenThrow(new SourceUnavailableException("registry down"));
        SettlementPoller poller = new SettlementPoller(engine, new SettlementProperties());

        assertDoesNotThrow(poller::poll);
        assertDoesNotThrow(poller::poll);
        verify(engine, times(2)).runPass();
    }

    @Test
    public void unexpected_errors_do_not_kill_the_scheduler() {
        SettlementEngine engine = mock(SettlementEngine.class);
        when(engine.runPass()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> new SettlementPoller(engine, new SettlementProperties()).poll());
    }
}
