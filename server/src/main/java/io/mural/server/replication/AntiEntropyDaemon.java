package io.mural.server.replication;

import io.mural.server.node.NodeState;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic reconciliation trigger.
 *
 * Goals:
 *  - Run ReconciliationService.reconcileAll() in the background at a fixed delay.
 *  - At most one round at a time (single-threaded scheduler).
 *  - A failing tick is logged and never cancels the schedule.
 *
 * Besides the Offline -> Online edge this is what eventually heals peers that
 * missed a push. A zero interval disables the daemon.
 */
public final class AntiEntropyDaemon {
    private static final Logger log = Logger.getLogger(AntiEntropyDaemon.class.getName());

    private final NodeState state;
    private final ReconciliationService reconciliation;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public AntiEntropyDaemon(NodeState state, ReconciliationService reconciliation, Duration interval) {
        if (interval.isNegative()) throw new IllegalArgumentException("interval must be >= 0");
        this.state = state;
        this.reconciliation = reconciliation;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "anti-entropy-" + state.nodeId());
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (interval.isZero()) {
            log.info("Anti-entropy daemon disabled (interval 0)");
            return;
        }
        scheduler.scheduleWithFixedDelay(
                this::tickSafe,
                interval.toMillis(),
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.log(Level.INFO, "Anti-entropy daemon started, interval {0}s", interval.toSeconds());
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    // ---------- internals ----------

    void tickSafe() {
        try {
            tick();
        } catch (Exception e) {
            log.log(Level.WARNING, "Anti-entropy tick failed", e);
        }
    }

    private void tick() {
        if (state.isOffline()) {
            return;
        }
        ReconciliationReport report = reconciliation.reconcileAll();
        if (report.pulled() > 0 || report.pushedBack() > 0) {
            log.log(Level.INFO, "Anti-entropy round repaired divergence: pulled={0} pushedBack={1}",
                    new Object[]{report.pulled(), report.pushedBack()});
        }
    }
}
