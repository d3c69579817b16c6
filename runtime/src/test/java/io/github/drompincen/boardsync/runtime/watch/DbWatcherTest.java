package io.github.drompincen.boardsync.runtime.watch;

import io.github.drompincen.boardsync.runtime.workspace.WorkspaceConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DbWatcherTest {

    @TempDir
    Path dir;

    @Mock private ScheduledExecutorService timer;
    @Mock private Clock clock;
    @Mock private ScheduledFuture<Object> future;

    private final List<Runnable> scheduled = new ArrayList<>();
    private final AtomicInteger notifications = new AtomicInteger();
    private DbWatcher watcher;

    @BeforeEach
    void setUp() {
        when(timer.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(inv -> {
            scheduled.add(inv.getArgument(0));
            return future;
        });
        when(clock.millis()).thenReturn(1_000L);
        watcher = new DbWatcher(timer, clock, 150, 500);
        watcher.addListener(notifications::incrementAndGet);
        watcher.start(new WorkspaceConfig(dir.toString(), dir.resolve("issues.db").toString()));
    }

    @AfterEach
    void tearDown() {
        watcher.close();
    }

    @Test
    void burstOfEventsDebouncesIntoOneNotification() {
        watcher.onFileEvent("issues.db");
        watcher.onFileEvent("issues.db");
        watcher.onFileEvent("issues.db");

        assertThat(scheduled).hasSize(3);
        verify(future, times(2)).cancel(false);
        verify(timer, times(3)).schedule(any(Runnable.class), eq(150L), eq(TimeUnit.MILLISECONDS));

        scheduled.get(2).run();
        assertThat(notifications).hasValue(1);
    }

    @Test
    void otherFilesInDirectoryAreIgnored() {
        watcher.onFileEvent("issues.db-wal");
        watcher.onFileEvent("notes.txt");

        assertThat(scheduled).isEmpty();
    }

    @Test
    void cooldownSwallowsEchoesThenExpires() {
        watcher.onFileEvent("issues.db");
        scheduled.get(0).run();

        when(clock.millis()).thenReturn(1_400L);
        watcher.onFileEvent("issues.db");
        assertThat(scheduled).hasSize(1);

        when(clock.millis()).thenReturn(1_600L);
        watcher.onFileEvent("issues.db");
        assertThat(scheduled).hasSize(2);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        watcher.addListener(() -> { throw new IllegalStateException("boom"); });
        AtomicInteger after = new AtomicInteger();
        watcher.addListener(after::incrementAndGet);

        watcher.onFileEvent("issues.db");
        scheduled.get(0).run();

        assertThat(notifications).hasValue(1);
        assertThat(after).hasValue(1);
    }

    @Test
    void rebindFollowsNewDatabaseAndResetsCooldown() {
        watcher.onFileEvent("issues.db");
        scheduled.get(0).run();

        watcher.rebind(new WorkspaceConfig(dir.toString(), dir.resolve("other.db").toString()));
        watcher.onFileEvent("issues.db");
        watcher.onFileEvent("other.db");

        assertThat(watcher.path()).isEqualTo(dir.resolve("other.db").toAbsolutePath().normalize());
        assertThat(scheduled).hasSize(2);
    }
}
