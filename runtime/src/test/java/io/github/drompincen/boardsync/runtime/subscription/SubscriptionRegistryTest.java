package io.github.drompincen.boardsync.runtime.subscription;

import io.github.drompincen.boardsync.protocol.api.Issue;
import io.github.drompincen.boardsync.protocol.subscription.SubscriptionSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionRegistryTest {

    private SubscriptionRegistry registry;
    private RecordingConnection c1;
    private RecordingConnection c2;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry();
        c1 = new RecordingConnection("c1");
        c2 = new RecordingConnection("c2");
    }

    @Test
    void attachIsIdempotentPerConnection() {
        SubscriptionSpec spec = SubscriptionSpec.of("all-issues");

        String key = registry.attach(spec, c1);
        registry.attach(spec, c1);
        registry.attach(spec, c2);

        assertThat(key).isEqualTo("all-issues");
        assertThat(registry.get(key).orElseThrow().subscribers()).containsExactlyInAnyOrder(c1, c2);
    }

    @Test
    void detachReportsPresenceAndKeepsEntry() {
        SubscriptionSpec spec = SubscriptionSpec.of("ready-issues");
        registry.attach(spec, c1);

        assertThat(registry.detach(spec, c1)).isTrue();
        assertThat(registry.detach(spec, c1)).isFalse();
        assertThat(registry.get("ready-issues")).isPresent();
    }

    @Test
    void firstApplyReportsEverythingAdded() {
        Delta delta = registry.applyItems("k", List.of(Issue.of("A", 1), Issue.of("B", 1)));

        assertThat(delta.added()).containsExactly("A", "B");
        assertThat(delta.updated()).isEmpty();
        assertThat(delta.removed()).isEmpty();
    }

    @Test
    void deltaIsMinimal() {
        registry.applyItems("k", List.of(Issue.of("A", 1), Issue.of("B", 1), Issue.of("C", 1)));

        Delta delta = registry.applyItems("k", List.of(
                Issue.of("A", 1),
                Issue.of("B", 2),
                Issue.of("D", 1)));

        assertThat(delta.added()).containsExactly("D");
        assertThat(delta.updated()).containsExactly("B");
        assertThat(delta.removed()).containsExactly("C");
        assertThat(registry.get("k").orElseThrow().itemsById()).containsOnlyKeys("A", "B", "D");
    }

    @Test
    void identicalRefetchIsEmpty() {
        registry.applyItems("k", List.of(Issue.of("A", 1).put("title", "x")));

        Delta delta = registry.applyItems("k", List.of(Issue.of("A", 1).put("title", "x")));

        assertThat(delta.isEmpty()).isTrue();
    }

    @Test
    void keysAreIsolated() {
        registry.applyItems("k1", List.of(Issue.of("A", 1)));
        registry.applyItems("k2", List.of(Issue.of("B", 1)));

        Delta delta = registry.applyItems("k1", List.of());

        assertThat(delta.removed()).containsExactly("A");
        assertThat(registry.get("k2").orElseThrow().itemsById()).containsOnlyKeys("B");
    }

    @Test
    void disconnectEvictsEntriesWithoutSubscribers() {
        registry.attach(SubscriptionSpec.of("all-issues"), c1);
        registry.attach(SubscriptionSpec.of("epics"), c1);
        registry.attach(SubscriptionSpec.of("epics"), c2);

        registry.onDisconnect(c1);

        assertThat(registry.get("all-issues")).isEmpty();
        assertThat(registry.get("epics").orElseThrow().subscribers()).containsExactly(c2);
    }

    @Test
    void clearDropsEverything() {
        registry.attach(SubscriptionSpec.of("issue-detail", Map.of("id", "UI-1")), c1);

        registry.clear();

        assertThat(registry.get("issue-detail?id=UI-1")).isEmpty();
    }

    @Test
    void sameKeyNeverRunsConcurrently() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> registry.withKeyLock("k", () -> {
                    int now = inFlight.incrementAndGet();
                    maxInFlight.accumulateAndGet(now, Math::max);
                    sleep(10);
                    inFlight.decrementAndGet();
                    return null;
                })));
            }
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInFlight.get()).isEqualTo(1);
    }

    @Test
    void clearDoesNotReleaseAHeldKeyLock() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean secondEntered = new AtomicBoolean();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> first = pool.submit(() -> registry.withKeyLock("k", () -> {
                holding.countDown();
                await(release);
                return null;
            }));
            assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
            registry.clear();

            Future<?> second = pool.submit(() -> registry.withKeyLock("k", () -> {
                secondEntered.set(true);
                return null;
            }));
            sleep(100);
            assertThat(secondEntered).isFalse();

            release.countDown();
            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
            assertThat(secondEntered).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void differentKeysRunInParallel() throws Exception {
        CountDownLatch both = new CountDownLatch(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> a = pool.submit(() -> registry.withKeyLock("a", () -> awaitBoth(both)));
            Future<Boolean> b = pool.submit(() -> registry.withKeyLock("b", () -> awaitBoth(both)));

            assertThat(a.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(b.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    private static boolean awaitBoth(CountDownLatch latch) {
        latch.countDown();
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
