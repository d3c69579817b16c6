package io.github.drompincen.boardsync.runtime.refresh;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Coalesces store-change signals into refresh passes.
 * <p>
 * Change signals debounce: each one restarts a short timer and one pass runs when it fires.
 * A mutation opens a gate instead, which resolves on the next change signal ({@link GateReason#WATCHER})
 * or after a timeout ({@link GateReason#TIMEOUT}); either way exactly one pass runs and the gate
 * clears once that pass completes. Mutations arriving while a gate is open ride it.
 * <p>
 * Timers fire on the scheduled executor; passes run on the pass executor so a slow pass never
 * delays a gate timeout or a debounce.
 */
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    public enum GateReason { WATCHER, TIMEOUT }

    private static final class MutationGate {
        private boolean resolved;
        private ScheduledFuture<?> timeout;
    }

    private final ScheduledExecutorService timer;
    private final Executor passExecutor;
    private final RefreshPass pass;
    private final long debounceMs;
    private final long gateTimeoutMs;

    private final Object lock = new Object();
    private ScheduledFuture<?> pendingDebounce;
    private long debounceSeq;
    private MutationGate gate;
    private volatile GateReason lastGateReason;

    public RefreshScheduler(ScheduledExecutorService timer, RefreshPass pass,
                            long debounceMs, long gateTimeoutMs) {
        this(timer, timer, pass, debounceMs, gateTimeoutMs);
    }

    public RefreshScheduler(ScheduledExecutorService timer, Executor passExecutor, RefreshPass pass,
                            long debounceMs, long gateTimeoutMs) {
        this.timer = timer;
        this.passExecutor = passExecutor;
        this.pass = pass;
        this.debounceMs = debounceMs;
        this.gateTimeoutMs = gateTimeoutMs;
    }

    /**
     * Signal from the change notifier.
     */
    public void onStoreChanged() {
        synchronized (lock) {
            if (gate != null) {
                resolveGate(gate, GateReason.WATCHER);
                return;
            }
            if (pendingDebounce != null) {
                pendingDebounce.cancel(false);
            }
            long seq = ++debounceSeq;
            pendingDebounce = timer.schedule(() -> fireDebounce(seq), debounceMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Opens the mutation gate unless one is already open.
     */
    public void triggerMutationRefresh() {
        synchronized (lock) {
            if (gate != null) {
                log.debug("Mutation rides the open refresh gate");
                return;
            }
            MutationGate opened = new MutationGate();
            gate = opened;
            opened.timeout = timer.schedule(() -> resolveGate(opened, GateReason.TIMEOUT),
                    gateTimeoutMs, TimeUnit.MILLISECONDS);
        }
    }

    public boolean isGateOpen() {
        synchronized (lock) {
            return gate != null;
        }
    }

    public Optional<GateReason> lastGateReason() {
        return Optional.ofNullable(lastGateReason);
    }

    public void close() {
        synchronized (lock) {
            if (pendingDebounce != null) {
                pendingDebounce.cancel(false);
                pendingDebounce = null;
            }
            debounceSeq++;
            if (gate != null && gate.timeout != null) {
                gate.timeout.cancel(false);
            }
            gate = null;
        }
    }

    private void resolveGate(MutationGate target, GateReason reason) {
        synchronized (lock) {
            if (gate != target || target.resolved) {
                return;
            }
            target.resolved = true;
            if (target.timeout != null) {
                target.timeout.cancel(false);
            }
        }
        lastGateReason = reason;
        log.debug("Mutation gate resolved ({}), refreshing active subscriptions", reason);
        passExecutor.execute(() -> runGatePass(target));
    }

    private void runGatePass(MutationGate target) {
        try {
            pass.refreshAll();
        } catch (RuntimeException e) {
            log.warn("Refresh after mutation failed: {}", e.getMessage(), e);
        } finally {
            synchronized (lock) {
                if (gate == target) {
                    gate = null;
                }
            }
        }
    }

    private void fireDebounce(long seq) {
        synchronized (lock) {
            // a stale timer must not drop the handle of the one that replaced it
            if (seq != debounceSeq) {
                return;
            }
            pendingDebounce = null;
        }
        passExecutor.execute(this::runDebounced);
    }

    private void runDebounced() {
        try {
            pass.refreshAll();
        } catch (RuntimeException e) {
            log.warn("Scheduled refresh failed: {}", e.getMessage(), e);
        }
    }
}
