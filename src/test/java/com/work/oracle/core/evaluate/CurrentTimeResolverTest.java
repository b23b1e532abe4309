package com.work.oracle.core.evaluate;

import com.work.oracle.core.chain.ChainClient;
import com.work.oracle.core.config.TimeSource;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class CurrentTimeResolverTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(5_000), ZoneOffset.UTC);

    @Test
    public void wall_clock_does_not_touch_chain() {
        ChainClient chain = mock(ChainClient.class);
        CurrentTimeResolver r = new CurrentTimeResolver(TimeSource.WALL_CLOCK, clock, chain);

        assertEquals(Instant.ofEpochSecond(5_000), r.now());
        verifyNoInteractions(chain);
    }

    @Test
    public void latest_block_uses_block_timestamp() {
        ChainClient chain = mock(ChainClient.class);
        when(chain.latestBlockTimestamp()).thenReturn(4_990L);
        CurrentTimeResolver r = new CurrentTimeResolver(TimeSource.LATEST_BLOCK, clock, chain);

        assertEquals(Instant.ofEpochSecond(4_990), r.now());
    }
}
