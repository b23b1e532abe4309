package com.work.oracle.core.execution;

import com.work.oracle.core.exception.SubmissionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.work.oracle.core.TestCampaigns.ORACLE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WorkerQueueAccountExecutorTest {

    @Test
    public void work_for_one_account_never_overlaps() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());

        try (WorkerQueueAccountExecutor ex = new WorkerQueueAccountExecutor(64, Duration.ofSeconds(10), "t-")) {
            ExecutorService callers = Executors.newFixedThreadPool(8);
            CountDownLatch done = new CountDownLatch(20);
            for (int i = 0; i < 20; i++) {
                final int n = i;
                callers.submit(() -> {
                    ex.execute(ORACLE, () -> {
                        int now = running.incrementAndGet();
                        maxRunning.accumulateAndGet(now, Math::max);
                        Thread.sleep(2);
                        order.add(n);
                        running.decrementAndGet();
                        return null;
                    });
                    done.countDown();
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
            callers.shutdownNow();
        }

        assertEquals(1, maxRunning.get());
        assertEquals(20, order.size());
    }

    @Test
    public void runtime_exceptions_propagate_unchanged() {
        try (WorkerQueueAccountExecutor ex = new WorkerQueueAccountExecutor(4, Duration.ofSeconds(5), "t-")) {
            SubmissionException boom = new SubmissionException("boom");
            SubmissionException thrown = assertThrows(SubmissionException.class,
                    () -> ex.execute(ORACLE, () -> {
                        throw boom;
                    }));
            assertEquals(boom, thrown);
        }
    }

    @Test
    public void slow_work_times_out_as_submission_error() {
        try (WorkerQueueAccountExecutor ex = new WorkerQueueAccountExecutor(4, Duration.ofMillis(50), "t-")) {
            assertThrows(WorkerQueueAccountExecutor.DispatchTimeoutException.class,
                    () -> ex.execute(ORACLE, () -> {
                        Thread.sleep(2_000);
                        return null;
                    }));
        }
    }

    @Test
    public void account_case_does_not_create_a_second_lane() {
        try (WorkerQueueAccountExecutor ex = new WorkerQueueAccountExecutor(4, Duration.ofSeconds(5), "t-")) {
            String lower = ex.execute(ORACLE.toLowerCase(), () -> Thread.currentThread().getName());
            String upper = ex.execute(ORACLE.toUpperCase().replace("0X", "0x"), () -> Thread.currentThread().getName());
            assertEquals(lower, upper);
            assertEquals(1, ex.laneCount());
        }
    }

    @Test
    public void closed_executor_rejects_new_work() {
        WorkerQueueAccountExecutor ex = new WorkerQueueAccountExecutor(4, Duration.ofSeconds(5), "t-");
        ex.execute(ORACLE, () -> 1);
        ex.close();
        assertThrows(WorkerQueueAccountExecutor.DispatchRejectedException.class,
                () -> ex.execute(ORACLE, () -> 2));
    }

    @Test
    public void timed_out_work_keeps_running_to_completion() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);

        try (WorkerQueueAccountExecutor ex = new WorkerQueueAccountExecutor(4, Duration.ofMillis(100), "t-")) {
            assertThrows(WorkerQueueAccountExecutor.DispatchTimeoutException.class,
                    () -> ex.execute(ORACLE, () -> {
                        started.countDown();
                        try {
                            release.await(5, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            interrupted.set(true);
                        }
                        finished.countDown();
                        return null;
                    }));
            assertTrue(started.await(1, TimeUnit.SECONDS));
            release.countDown();
            assertTrue(finished.await(5, TimeUnit.SECONDS));
        }
        assertFalse(interrupted.get());
    }

    @Test
    public void rejects_invalid_configuration() {
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerQueueAccountExecutor(0, Duration.ofSeconds(1), "t-"));
        assertThrows(IllegalArgumentException.class,
                () -> new WorkerQueueAccountExecutor(4, Duration.ZERO, "t-"));
    }
}
