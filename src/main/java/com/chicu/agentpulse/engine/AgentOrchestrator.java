package com.chicu.agentpulse.engine;

import com.chicu.agentpulse.journal.ActionJournalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Оркестратор циклов агента.
 *
 * <ul>
 *     <li>каждый цикл планируется отдельно, первый тик через его же интервал</li>
 *     <li>одна итерация цикла за раз: плановый тик и ручной запуск делят один guard</li>
 *     <li>упавшая итерация пишется в журнал как FAILED и не ломает расписание</li>
 * </ul>
 */
@Slf4j
@Service
public class AgentOrchestrator {

    static final String KEY_PREFIX = "loop:";

    private final List<AgentLoop> loops;
    private final SchedulerService scheduler;
    private final ActionJournalService journal;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Map<String, LoopState> states = new ConcurrentHashMap<>();

    public AgentOrchestrator(List<AgentLoop> loops,
                             SchedulerService scheduler,
                             ActionJournalService journal,
                             Clock clock) {
        this.loops = loops.stream()
                .sorted(Comparator.comparingInt(AgentLoop::priority).reversed())
                .toList();
        this.scheduler = scheduler;
        this.journal = journal;
        this.clock = clock;
        this.loops.forEach(l -> states.put(l.name(), new LoopState()));
    }

    // =====================================================
    // ▶ START / ⏹ STOP
    // =====================================================

    /**
     * Планирует все циклы и один раз синхронно прогоняет самый приоритетный,
     * чтобы остальные стартовали уже с данными.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.info("▶ Orchestrator already running");
            return;
        }

        log.info("▶ Orchestrator START: {} loop(s)", loops.size());
        for (AgentLoop loop : loops) {
            scheduler.scheduleAtFixedRate(KEY_PREFIX + loop.name(), () -> fire(loop), loop.interval(), loop.interval());
        }

        if (!loops.isEmpty()) {
            fire(loops.get(0));
        }
    }

    /**
     * Только снимает флаг: начатые итерации доходят до конца, новые тики становятся no-op.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("⏹ Orchestrator STOP (in-flight: {})", inFlight);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    // =====================================================
    // 🔁 FIRE
    // =====================================================

    public LoopRunResult trigger(String name) {
        Optional<AgentLoop> loop = find(name);
        if (loop.isEmpty()) {
            log.warn("⚠ Manual trigger: unknown loop '{}'", name);
            return LoopRunResult.UNKNOWN_LOOP;
        }
        log.info("👆 Manual trigger '{}'", name);
        return fire(loop.get());
    }

    LoopRunResult fire(AgentLoop loop) {
        String name = loop.name();
        LoopState st = states.computeIfAbsent(name, k -> new LoopState());

        if (!running.get()) {
            log.debug("⏭ LOOP SKIP name={} reason=stopped", name);
            return LoopRunResult.SKIPPED_STOPPED;
        }
        if (!inFlight.add(name)) {
            log.info("⏭ LOOP SKIP name={} reason=overlap", name);
            return LoopRunResult.SKIPPED_OVERLAP;
        }

        long started = System.currentTimeMillis();
        st.lastStartedAt = clock.instant();
        st.runs.incrementAndGet();
        log.info("▶ LOOP START name={}", name);

        try {
            loop.runIteration();
            st.finish(LoopRunResult.RAN, null, clock.instant());
            log.info("✅ LOOP DONE name={} tookMs={}", name, System.currentTimeMillis() - started);
            return LoopRunResult.RAN;

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return failed(loop, st, ie);
        } catch (VirtualMachineError fatal) {
            // OOM и т.п. — процесс не в состоянии продолжать
            st.failures.incrementAndGet();
            st.finish(LoopRunResult.FAILED, fatal.getClass().getSimpleName(), clock.instant());
            throw fatal;
        } catch (Throwable t) {
            // Error из итерации не должен отменять следующие запуски в ScheduledExecutorService
            return failed(loop, st, t);
        } finally {
            inFlight.remove(name);
        }
    }

    private LoopRunResult failed(AgentLoop loop, LoopState st, Throwable e) {
        String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        st.failures.incrementAndGet();
        st.finish(LoopRunResult.FAILED, msg, clock.instant());
        log.error("❌ LOOP FAILED name={} : {}", loop.name(), msg, e);

        try {
            journal.recordFailure(loop.actionType(), "Loop " + loop.name() + " failed", e);
        } catch (RuntimeException journalError) {
            log.error("❌ could not journal failure of '{}': {}", loop.name(), journalError.getMessage());
        }
        return LoopRunResult.FAILED;
    }

    // =====================================================
    // ℹ STATUS
    // =====================================================

    public EngineStatus status() {
        List<LoopStatus> list = loops.stream()
                .map(l -> {
                    LoopState st = states.get(l.name());
                    return LoopStatus.builder()
                            .name(l.name())
                            .interval(l.interval())
                            .priority(l.priority())
                            .inFlight(inFlight.contains(l.name()))
                            .scheduled(scheduler.isActive(KEY_PREFIX + l.name()))
                            .lastStartedAt(st.lastStartedAt)
                            .lastFinishedAt(st.lastFinishedAt)
                            .lastResult(st.lastResult)
                            .lastError(st.lastError)
                            .runs(st.runs.get())
                            .failures(st.failures.get())
                            .build();
                })
                .toList();
        return new EngineStatus(running.get(), list);
    }

    public List<String> loopNames() {
        return loops.stream().map(AgentLoop::name).toList();
    }

    private Optional<AgentLoop> find(String name) {
        if (name == null) return Optional.empty();
        return loops.stream().filter(l -> l.name().equalsIgnoreCase(name.trim())).findFirst();
    }

    private static final class LoopState {
        private volatile Instant lastStartedAt;
        private volatile Instant lastFinishedAt;
        private volatile LoopRunResult lastResult;
        private volatile String lastError;
        private final AtomicLong runs = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();

        void finish(LoopRunResult result, String error, Instant at) {
            this.lastResult = result;
            this.lastError = error;
            this.lastFinishedAt = at;
        }
    }
}
