package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.exception.SessionAlreadyExistsException;
import com.phillippitts.insightbot.service.audio.SessionRecorder;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry();

    @Test
    void createsSessionOncePerGuild() {
        GuildSession first = registry.createIfAbsent(1L, SessionRegistryTest::session);

        assertThatThrownBy(() -> registry.createIfAbsent(1L, SessionRegistryTest::session))
                .isInstanceOf(SessionAlreadyExistsException.class);
        assertThat(registry.get(1L)).containsSame(first);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void guildsAreIndependent() {
        registry.createIfAbsent(1L, SessionRegistryTest::session);
        registry.createIfAbsent(2L, SessionRegistryTest::session);

        assertThat(registry.guildIds()).containsExactlyInAnyOrder(1L, 2L);
    }

    @Test
    void concurrentCreatesForSameGuildYieldExactlyOneSession() throws Exception {
        // Arrange
        int callers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // Act
        for (int i = 0; i < callers; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    registry.createIfAbsent(7L, SessionRegistryTest::session);
                    successes.incrementAndGet();
                } catch (SessionAlreadyExistsException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Assert
        assertThat(successes.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(callers - 1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void onlyOneConcurrentRemovalReceivesSession() {
        registry.createIfAbsent(1L, SessionRegistryTest::session);

        assertThat(registry.remove(1L)).isPresent();
        assertThat(registry.remove(1L)).isEmpty();
    }

    @Test
    void conditionalRemoveIgnoresReplacedSession() {
        GuildSession stale = session(1L);
        registry.createIfAbsent(1L, SessionRegistryTest::session);

        assertThat(registry.remove(1L, stale)).isFalse();
        assertThat(registry.get(1L)).isPresent();
    }

    private static GuildSession session(long guildId) {
        return new GuildSession(guildId, 10L, 20L, new SessionRecorder(guildId, Clock.systemUTC()), 100);
    }
}
