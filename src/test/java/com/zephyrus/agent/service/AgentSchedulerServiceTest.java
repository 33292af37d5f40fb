package com.zephyrus.agent.service;

import com.zephyrus.agent.AgentFixtures.ManualExecutor;
import com.zephyrus.agent.AgentFixtures.MutableClock;
import com.zephyrus.agent.model.Schedule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AgentSchedulerServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private ManualExecutor workers;
    private AgentSchedulerService scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        workers = new ManualExecutor();
        scheduler = new AgentSchedulerService(clock, workers, 250);
    }

    @Test
    void shouldComputeFirstDueTimeOnRegister() {
        Instant due = scheduler.register("a", Schedule.interval("s", 5), () -> { });

        assertEquals(T0.plusSeconds(5), due);
        assertEquals(T0.plusSeconds(5), scheduler.nextDue("a").orElseThrow());
    }

    @Test
    void shouldRunTwiceInElevenSecondsForFiveSecondInterval() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.register("a", Schedule.interval("s", 5), runs::incrementAndGet);

        for (int i = 0; i < 44; i++) {
            clock.advance(Duration.ofMillis(250));
            scheduler.tick();
            workers.runAll();
        }

        assertEquals(2, runs.get());
    }

    @Test
    void shouldSkipDueTickWhileRunInFlight() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.register("a", Schedule.interval("s", 5), runs::incrementAndGet);

        clock.advance(Duration.ofSeconds(5));
        scheduler.tick();
        clock.advance(Duration.ofSeconds(5));
        scheduler.tick();

        assertEquals(1, workers.pendingCount());
        assertTrue(scheduler.isInFlight("a"));

        workers.runAll();

        assertEquals(1, runs.get());
        assertFalse(scheduler.isInFlight("a"));
        assertEquals(T0.plusSeconds(15), scheduler.nextDue("a").orElseThrow());
    }

    @Test
    void shouldRejectManualDispatchWhileRunInFlight() {
        assertTrue(scheduler.dispatchNow("a", () -> { }));
        assertFalse(scheduler.dispatchNow("a", () -> { }));

        workers.runAll();

        assertTrue(scheduler.dispatchNow("a", () -> { }));
    }

    @Test
    void shouldNotDispatchAfterDeregister() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.register("a", Schedule.interval("s", 5), runs::incrementAndGet);

        assertTrue(scheduler.deregister("a"));
        clock.advance(Duration.ofSeconds(30));
        scheduler.tick();
        workers.runAll();

        assertEquals(0, runs.get());
        assertFalse(scheduler.isRegistered("a"));
        assertFalse(scheduler.deregister("a"));
    }

    @Test
    void shouldLetInFlightRunFinishAfterDeregister() {
        AtomicInteger runs = new AtomicInteger();
        scheduler.register("a", Schedule.interval("s", 5), runs::incrementAndGet);
        clock.advance(Duration.ofSeconds(5));
        scheduler.tick();

        scheduler.deregister("a");
        workers.runAll();

        assertEquals(1, runs.get());
    }

    @Test
    void shouldKeepOtherAgentsOnTimeWhileOneIsBusy() throws Exception {
        ExecutorService pool = Executors.newCachedThreadPool();
        try {
            AgentSchedulerService threaded = new AgentSchedulerService(clock, pool, 250);
            CountDownLatch release = new CountDownLatch(1);
            AtomicInteger slowRuns = new AtomicInteger();
            AtomicInteger fastRuns = new AtomicInteger();
            threaded.register("slow", Schedule.interval("s1", 5), () -> {
                slowRuns.incrementAndGet();
                awaitQuietly(release);
            });
            threaded.register("fast", Schedule.interval("s2", 5), fastRuns::incrementAndGet);

            clock.advance(Duration.ofSeconds(5));
            threaded.tick();
            awaitIdle(threaded, "fast");
            clock.advance(Duration.ofSeconds(5));
            threaded.tick();
            awaitIdle(threaded, "fast");

            assertEquals(2, fastRuns.get());
            assertEquals(1, slowRuns.get());
            assertTrue(threaded.isInFlight("slow"));
            assertEquals(T0.plusSeconds(15), threaded.nextDue("fast").orElseThrow());
            assertEquals(T0.plusSeconds(15), threaded.nextDue("slow").orElseThrow());

            release.countDown();
            awaitIdle(threaded, "slow");
        } finally {
            pool.shutdownNow();
        }
    }

    private static void awaitIdle(AgentSchedulerService scheduler, String agentId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (scheduler.isInFlight(agentId)) {
            if (System.currentTimeMillis() > deadline) {
                fail("Agent " + agentId + " still in flight");
            }
            Thread.sleep(5);
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void shouldSurviveFailingTask() {
        scheduler.register("a", Schedule.interval("s", 5), () -> {
            throw new IllegalStateException("boom");
        });

        clock.advance(Duration.ofSeconds(5));
        scheduler.tick();
        workers.runAll();

        assertFalse(scheduler.isInFlight("a"));
        assertTrue(scheduler.isRegistered("a"));
    }
}
