package com.zephyrus.agent.service;

import com.zephyrus.agent.model.Schedule;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single dispatch loop over a due-time priority queue, one entry per running agent.
 *
 * <p>Each tick pops every elapsed entry, re-queues it at its next due time right
 * away, and hands the run to the worker pool. An agent whose previous run is still
 * in flight is skipped for that tick without a record; the cycle simply moves to
 * the next due time. Deregistering removes the queue entry but leaves an
 * in-flight run alone.
 */
@Slf4j
@Service
public class AgentSchedulerService {

    private final Clock clock;
    private final Executor workers;
    private final long tickMillis;

    private final PriorityQueue<DueEntry> queue = new PriorityQueue<>(
        Comparator.comparing(DueEntry::due).thenComparingLong(DueEntry::sequence));
    private final Map<String, DueEntry> entries = new HashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();

    private ScheduledExecutorService dispatchLoop;

    @Autowired
    public AgentSchedulerService(Clock clock,
                                 @Qualifier("agentWorkerPool") Executor workers,
                                 @Value("${agent.scheduler.tick-millis:250}") long tickMillis) {
        this.clock = clock;
        this.workers = workers;
        this.tickMillis = tickMillis;
    }

    @PostConstruct
    public synchronized void start() {
        if (dispatchLoop != null) {
            return;
        }
        dispatchLoop = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "agent-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        dispatchLoop.scheduleWithFixedDelay(this::safeTick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        log.info("Scheduler started, tick every {} ms", tickMillis);
    }

    @PreDestroy
    public synchronized void shutdown() {
        if (dispatchLoop != null) {
            dispatchLoop.shutdownNow();
            dispatchLoop = null;
            log.info("Scheduler stopped");
        }
    }

    /**
     * Queues an agent at its first due time after now, replacing any existing entry.
     *
     * @return the first due time
     */
    public synchronized Instant register(String agentId, Schedule schedule, Runnable task) {
        removeEntry(agentId);
        Instant due = schedule.nextDueAfter(clock.instant());
        DueEntry entry = new DueEntry(agentId, schedule, task, due, sequence.incrementAndGet());
        entries.put(agentId, entry);
        queue.add(entry);
        log.debug("Agent {} registered, first due at {}", agentId, due);
        return due;
    }

    public synchronized boolean deregister(String agentId) {
        boolean removed = removeEntry(agentId);
        if (removed) {
            log.debug("Agent {} deregistered", agentId);
        }
        return removed;
    }

    public synchronized boolean isRegistered(String agentId) {
        return entries.containsKey(agentId);
    }

    public synchronized Optional<Instant> nextDue(String agentId) {
        return Optional.ofNullable(entries.get(agentId)).map(DueEntry::due);
    }

    public boolean isInFlight(String agentId) {
        return inFlight.contains(agentId);
    }

    /**
     * Runs {@code task} for the agent now, outside its schedule.
     *
     * @return false if a run for this agent is already in flight
     */
    public boolean dispatchNow(String agentId, Runnable task) {
        return launch(agentId, task);
    }

    /**
     * One pass of the dispatch loop.
     */
    public void tick() {
        Instant now = clock.instant();
        List<DueEntry> due = new ArrayList<>();

        synchronized (this) {
            while (!queue.isEmpty() && !queue.peek().due().isAfter(now)) {
                DueEntry entry = queue.poll();
                due.add(entry);
                try {
                    DueEntry next = new DueEntry(entry.agentId(), entry.schedule(), entry.task(),
                        entry.schedule().nextDueAfter(now), sequence.incrementAndGet());
                    entries.put(entry.agentId(), next);
                    queue.add(next);
                } catch (IllegalStateException e) {
                    entries.remove(entry.agentId());
                    log.warn("Agent {} dropped from schedule: {}", entry.agentId(), e.getMessage());
                }
            }
        }

        for (DueEntry entry : due) {
            if (!launch(entry.agentId(), entry.task())) {
                log.debug("Agent {} still running, deferring to next due time", entry.agentId());
            }
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    private boolean launch(String agentId, Runnable task) {
        if (!inFlight.add(agentId)) {
            return false;
        }
        try {
            workers.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Run for agent {} failed outside the pipeline", agentId, e);
                } finally {
                    inFlight.remove(agentId);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(agentId);
            log.error("Worker pool rejected run for agent {}", agentId, e);
            return false;
        }
    }

    private boolean removeEntry(String agentId) {
        DueEntry existing = entries.remove(agentId);
        if (existing == null) {
            return false;
        }
        queue.remove(existing);
        return true;
    }

    private static final class DueEntry {
        private final String agentId;
        private final Schedule schedule;
        private final Runnable task;
        private final Instant due;
        private final long sequence;

        private DueEntry(String agentId, Schedule schedule, Runnable task, Instant due, long sequence) {
            this.agentId = agentId;
            this.schedule = schedule;
            this.task = task;
            this.due = due;
            this.sequence = sequence;
        }

        String agentId() {
            return agentId;
        }

        Schedule schedule() {
            return schedule;
        }

        Runnable task() {
            return task;
        }

        Instant due() {
            return due;
        }

        long sequence() {
            return sequence;
        }
    }
}
