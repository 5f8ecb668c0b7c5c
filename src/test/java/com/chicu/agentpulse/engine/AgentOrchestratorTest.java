package com.chicu.agentpulse.engine;

import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.journal.ActionJournalService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentOrchestratorTest {

    @Mock private SchedulerService scheduler;
    @Mock private ActionJournalService journal;

    private final Clock clock = Clock.fixed(Instant.parse("2026-02-10T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void start_shouldScheduleEveryLoopAndRunTopPriorityOnce() {
        FakeLoop refresh = new FakeLoop("data-refresh", 100, Duration.ofMinutes(2));
        FakeLoop posting = new FakeLoop("insight-posting", 50, Duration.ofMinutes(30));
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(posting, refresh), scheduler, journal, clock);

        orchestrator.start();

        assertTrue(orchestrator.isRunning());
        assertEquals(1, refresh.calls.get());
        assertEquals(0, posting.calls.get());
        verify(scheduler).scheduleAtFixedRate(eq("loop:data-refresh"), any(), eq(Duration.ofMinutes(2)), eq(Duration.ofMinutes(2)));
        verify(scheduler).scheduleAtFixedRate(eq("loop:insight-posting"), any(), eq(Duration.ofMinutes(30)), eq(Duration.ofMinutes(30)));
        assertEquals(List.of("data-refresh", "insight-posting"), orchestrator.loopNames());
    }

    @Test
    void secondStart_shouldBeNoOp() {
        FakeLoop refresh = new FakeLoop("data-refresh", 100, Duration.ofMinutes(2));
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(refresh), scheduler, journal, clock);

        orchestrator.start();
        orchestrator.start();

        assertEquals(1, refresh.calls.get());
        verify(scheduler, times(1)).scheduleAtFixedRate(anyString(), any(), any(), any());
    }

    @Test
    void stoppedEngine_shouldSkipTicks() {
        FakeLoop refresh = new FakeLoop("data-refresh", 100, Duration.ofMinutes(2));
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(refresh), scheduler, journal, clock);

        assertEquals(LoopRunResult.SKIPPED_STOPPED, orchestrator.fire(refresh));

        orchestrator.start();
        orchestrator.stop();

        assertEquals(LoopRunResult.SKIPPED_STOPPED, orchestrator.trigger("data-refresh"));
        assertEquals(1, refresh.calls.get());
        assertFalse(orchestrator.status().running());
    }

    @Test
    void overlappingTick_shouldBeSkippedWithoutWork() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeLoop voting = new FakeLoop("voting", 40, Duration.ofHours(1)) {
            @Override
            public void runIteration() throws Exception {
                super.runIteration();
                if (calls.get() > 1) {
                    entered.countDown();
                    assertTrue(release.await(5, TimeUnit.SECONDS));
                }
            }
        };
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(voting), scheduler, journal, clock);
        orchestrator.start();

        CompletableFuture<LoopRunResult> slow = CompletableFuture.supplyAsync(() -> orchestrator.fire(voting));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertEquals(LoopRunResult.SKIPPED_OVERLAP, orchestrator.fire(voting));
        assertEquals(LoopRunResult.SKIPPED_OVERLAP, orchestrator.trigger("voting"));
        assertTrue(orchestrator.status().loops().get(0).inFlight());

        release.countDown();
        assertEquals(LoopRunResult.RAN, slow.get(5, TimeUnit.SECONDS));
        assertEquals(2, voting.calls.get());
        assertFalse(orchestrator.status().loops().get(0).inFlight());
    }

    @Test
    void failedIteration_shouldBeJournaledAndNotBreakNextTick() {
        FakeLoop voting = new FakeLoop("voting", 40, Duration.ofHours(1));
        voting.failNext = new IllegalStateException("forum unreachable");
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(voting), scheduler, journal, clock);

        orchestrator.start();

        verify(journal).recordFailure(eq(ActionType.VOTE), eq("Loop voting failed"), any(Throwable.class));
        LoopStatus st = orchestrator.status().loops().get(0);
        assertEquals(LoopRunResult.FAILED, st.lastResult());
        assertEquals("forum unreachable", st.lastError());
        assertEquals(1, st.failures());

        assertEquals(LoopRunResult.RAN, orchestrator.fire(voting));
        st = orchestrator.status().loops().get(0);
        assertEquals(LoopRunResult.RAN, st.lastResult());
        assertEquals(2, st.runs());
        assertNull(st.lastError());
    }

    @Test
    void errorFromIteration_shouldNotCancelScheduledTicks() {
        FakeLoop voting = new FakeLoop("voting", 40, Duration.ofHours(1));
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(voting), scheduler, journal, clock);
        orchestrator.start();

        ArgumentCaptor<Runnable> tick = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(eq("loop:voting"), tick.capture(), any(), any());

        voting.failNext = new AssertionError("invariant broken");
        assertDoesNotThrow(() -> tick.getValue().run());

        verify(journal).recordFailure(eq(ActionType.VOTE), eq("Loop voting failed"), any(AssertionError.class));
        LoopStatus st = orchestrator.status().loops().get(0);
        assertEquals(LoopRunResult.FAILED, st.lastResult());
        assertEquals("invariant broken", st.lastError());
        assertFalse(st.inFlight());

        tick.getValue().run();
        assertEquals(LoopRunResult.RAN, orchestrator.status().loops().get(0).lastResult());
        assertEquals(3, voting.calls.get());
    }

    @Test
    void virtualMachineError_shouldPropagateAndReleaseLoop() {
        FakeLoop voting = new FakeLoop("voting", 40, Duration.ofHours(1));
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(voting), scheduler, journal, clock);
        orchestrator.start();

        voting.failNext = new OutOfMemoryError("heap");
        assertThrows(OutOfMemoryError.class, () -> orchestrator.fire(voting));

        verify(journal, never()).recordFailure(any(ActionType.class), anyString(), any(Throwable.class));
        assertEquals(LoopRunResult.FAILED, orchestrator.status().loops().get(0).lastResult());
        assertEquals(LoopRunResult.RAN, orchestrator.fire(voting));
    }

    @Test
    void journalOutage_shouldNotEscapeFailureHandling() {
        FakeLoop voting = new FakeLoop("voting", 40, Duration.ofHours(1));
        voting.failNext = new IllegalStateException("boom");
        when(journal.recordFailure(any(ActionType.class), anyString(), any(Throwable.class)))
                .thenThrow(new IllegalStateException("db down"));
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(voting), scheduler, journal, clock);

        assertDoesNotThrow(orchestrator::start);
        assertEquals(LoopRunResult.FAILED, orchestrator.status().loops().get(0).lastResult());
    }

    @Test
    void manualTrigger_shouldUseSamePathAndRejectUnknownLoops() {
        FakeLoop refresh = new FakeLoop("data-refresh", 100, Duration.ofMinutes(2));
        FakeLoop snapshot = new FakeLoop("snapshot", 10, Duration.ofHours(24));
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(refresh, snapshot), scheduler, journal, clock);
        orchestrator.start();

        assertEquals(LoopRunResult.RAN, orchestrator.trigger(" SNAPSHOT "));
        assertEquals(1, snapshot.calls.get());
        assertEquals(LoopRunResult.UNKNOWN_LOOP, orchestrator.trigger("mining"));
        assertEquals(LoopRunResult.UNKNOWN_LOOP, orchestrator.trigger(null));
    }

    @Test
    void status_shouldReportSchedulerState() {
        FakeLoop refresh = new FakeLoop("data-refresh", 100, Duration.ofMinutes(2));
        when(scheduler.isActive("loop:data-refresh")).thenReturn(true);
        AgentOrchestrator orchestrator = new AgentOrchestrator(List.of(refresh), scheduler, journal, clock);
        orchestrator.start();

        LoopStatus st = orchestrator.status().loops().get(0);

        assertTrue(st.scheduled());
        assertEquals(100, st.priority());
        assertEquals(Instant.parse("2026-02-10T12:00:00Z"), st.lastFinishedAt());
        assertEquals(LoopRunResult.RAN, st.lastResult());
    }

    static class FakeLoop implements AgentLoop {
        final String name;
        final int priority;
        final Duration interval;
        final AtomicInteger calls = new AtomicInteger();
        volatile Throwable failNext;

        FakeLoop(String name, int priority, Duration interval) {
            this.name = name;
            this.priority = priority;
            this.interval = interval;
        }

        @Override public String name() { return name; }
        @Override public ActionType actionType() { return ActionType.VOTE; }
        @Override public Duration interval() { return interval; }
        @Override public int priority() { return priority; }

        @Override
        public void runIteration() throws Exception {
            calls.incrementAndGet();
            Throwable t = failNext;
            if (t != null) {
                failNext = null;
                if (t instanceof Error) throw (Error) t;
                throw (Exception) t;
            }
        }
    }
}
