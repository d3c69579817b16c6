package io.github.drompincen.boardsync.runtime.watch;

import io.github.drompincen.boardsync.runtime.workspace.WorkspaceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Watches the workspace database file and tells listeners when it changed.
 * Events debounce into one notification; a cooldown after each notification
 * swallows the echo of bd's own follow-up writes.
 */
public class DbWatcher {

    private static final Logger log = LoggerFactory.getLogger(DbWatcher.class);

    private final ScheduledExecutorService timer;
    private final Clock clock;
    private final long debounceMs;
    private final long cooldownMs;
    private final List<StoreChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "db-watcher");
        t.setDaemon(true);
        return t;
    });

    private final Object lock = new Object();
    private volatile Path currentPath;
    private WatchService watchService;
    private ScheduledFuture<?> pending;
    private volatile long cooldownUntil;

    public DbWatcher(ScheduledExecutorService timer, Clock clock, long debounceMs, long cooldownMs) {
        this.timer = timer;
        this.clock = clock;
        this.debounceMs = debounceMs;
        this.cooldownMs = cooldownMs;
    }

    public void addListener(StoreChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(StoreChangeListener listener) {
        listeners.remove(listener);
    }

    public Path path() {
        return currentPath;
    }

    public void start(WorkspaceConfig workspace) {
        bind(Path.of(workspace.dbPath()));
    }

    /**
     * Moves the watch to another workspace database. A no-op when the path is unchanged.
     */
    public void rebind(WorkspaceConfig workspace) {
        Path next = Path.of(workspace.dbPath()).toAbsolutePath().normalize();
        if (next.equals(currentPath)) {
            return;
        }
        log.info("Rebinding database watcher {} -> {}", currentPath, next);
        cooldownUntil = 0;
        bind(next);
    }

    public void close() {
        synchronized (lock) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
            closeWatchService();
        }
        executor.shutdownNow();
        log.info("Database watcher stopped");
    }

    private void bind(Path dbPath) {
        Path path = dbPath.toAbsolutePath().normalize();
        synchronized (lock) {
            closeWatchService();
            currentPath = path;
            if (!Files.exists(path)) {
                log.warn("Resolved database missing: {} (set BEADS_DB or run `bd init` in the workspace)", path);
            }
            Path dir = path.getParent();
            if (dir == null || !Files.isDirectory(dir)) {
                log.warn("Unable to watch {}: directory does not exist", dir);
                return;
            }
            try {
                WatchService service = FileSystems.getDefault().newWatchService();
                dir.register(service, StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_DELETE);
                watchService = service;
                executor.submit(() -> pollEvents(service));
                log.info("Watching database {}", path);
            } catch (IOException e) {
                log.warn("Unable to watch directory {}: {}", dir, e.getMessage());
            }
        }
    }

    private void pollEvents(WatchService service) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                WatchKey key = service.take();
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.context() instanceof Path changed) {
                        onFileEvent(changed.getFileName().toString());
                    }
                }
                if (!key.reset()) {
                    log.warn("Watch key for {} is no longer valid", currentPath);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ClosedWatchServiceException e) {
            log.debug("Watch service closed");
        }
    }

    /**
     * Handles one filesystem event for {@code fileName} in the watched directory.
     */
    void onFileEvent(String fileName) {
        Path path = currentPath;
        if (path == null || !path.getFileName().toString().equals(fileName)) {
            return;
        }
        if (clock.millis() < cooldownUntil) {
            log.debug("Ignoring change to {} during cooldown", fileName);
            return;
        }
        synchronized (lock) {
            if (pending != null) {
                pending.cancel(false);
            }
            pending = timer.schedule(this::fire, debounceMs, TimeUnit.MILLISECONDS);
        }
    }

    private void fire() {
        synchronized (lock) {
            pending = null;
        }
        cooldownUntil = clock.millis() + cooldownMs;
        log.debug("Database {} changed", currentPath);
        for (StoreChangeListener listener : listeners) {
            try {
                listener.onStoreChanged();
            } catch (Exception e) {
                log.error("Store change listener failed", e);
            }
        }
    }

    private void closeWatchService() {
        if (watchService == null) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            log.debug("Error closing watch service: {}", e.getMessage());
        }
        watchService = null;
    }
}
