package com.phillippitts.insightbot.service.audio;

import com.phillippitts.insightbot.domain.AudioSnapshot;
import com.phillippitts.insightbot.exception.NoAudioException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionRecorderTest {

    private static final long GUILD = 42L;
    private static final long ALICE = 1L;
    private static final long BOB = 2L;

    private SessionRecorder recorder;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        recorder = new SessionRecorder(GUILD, clock);
    }

    @Test
    void flushReturnsFragmentsPerSpeakerInArrivalOrder() {
        // Arrange
        recorder.ingest(ALICE, bytes(1));
        recorder.ingest(ALICE, bytes(2));
        recorder.ingest(BOB, bytes(9));
        recorder.ingest(ALICE, bytes(3));

        // Act
        AudioSnapshot snapshot = recorder.flush();

        // Assert
        assertThat(snapshot.guildId()).isEqualTo(GUILD);
        assertThat(snapshot.speakerCount()).isEqualTo(2);
        assertThat(snapshot.fragments().get(ALICE)).extracting(b -> b[0]).containsExactly((byte) 1, (byte) 2, (byte) 3);
        assertThat(snapshot.fragments().get(BOB)).extracting(b -> b[0]).containsExactly((byte) 9);
        assertThat(snapshot.sessionStartedAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z").toEpochMilli());
    }

    @Test
    void flushResetsRecorder() {
        recorder.ingest(ALICE, bytes(1));

        recorder.flush();

        assertThat(recorder.hasAudio()).isFalse();
        assertThat(recorder.bufferedSpeakers()).isEmpty();
        assertThatThrownBy(recorder::flush).isInstanceOf(NoAudioException.class);
    }

    @Test
    void flushOfEmptyRecorderThrowsNoAudio() {
        assertThatThrownBy(recorder::flush)
                .isInstanceOf(NoAudioException.class)
                .hasMessageContaining(String.valueOf(GUILD));
    }

    @Test
    void ignoresNullAndEmptyFragments() {
        assertThat(recorder.ingest(ALICE, null)).isFalse();
        assertThat(recorder.ingest(ALICE, new byte[0])).isFalse();
        assertThat(recorder.hasAudio()).isFalse();
    }

    @Test
    void rejectsFragmentTooLargeForFrameFileAndKeepsTheRest() {
        // Arrange
        recorder.ingest(ALICE, bytes(1));

        // Act
        boolean accepted = recorder.ingest(ALICE, new byte[AudioFrameWriter.MAX_FRAGMENT_BYTES + 1]);
        recorder.ingest(ALICE, bytes(2));

        // Assert
        assertThat(accepted).isFalse();
        assertThat(recorder.flush().fragments().get(ALICE)).extracting(f -> f[0]).containsExactly((byte) 1, (byte) 2);
    }

    @Test
    void fragmentsAreCopiedOnIngest() {
        byte[] reused = bytes(5);
        recorder.ingest(ALICE, reused);
        reused[0] = 77;

        AudioSnapshot snapshot = recorder.flush();

        assertThat(snapshot.fragments().get(ALICE).get(0)[0]).isEqualTo((byte) 5);
    }

    @Test
    void fragmentsAfterFlushGoToNextFlush() {
        recorder.ingest(ALICE, bytes(1));
        AudioSnapshot first = recorder.flush();

        recorder.ingest(ALICE, bytes(2));
        AudioSnapshot second = recorder.flush();

        assertThat(first.fragments().get(ALICE)).extracting(b -> b[0]).containsExactly((byte) 1);
        assertThat(second.fragments().get(ALICE)).extracting(b -> b[0]).containsExactly((byte) 2);
        assertThat(second.sequence()).isEqualTo(first.sequence() + 1);
    }

    @Test
    void reportsBufferedSpeakersAndBytes() {
        recorder.ingest(BOB, new byte[10]);
        recorder.ingest(ALICE, new byte[5]);

        assertThat(recorder.bufferedSpeakers()).containsExactly(ALICE, BOB);
        assertThat(recorder.bufferedBytes()).isEqualTo(15);
    }

    @Test
    void concurrentIngestAndFlushNeverLoseOrDuplicateFragments() throws Exception {
        // Arrange
        int writers = 4;
        int perWriter = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < writers; w++) {
            long speaker = w;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    recorder.ingest(speaker, new byte[] {1});
                }
                return null;
            }));
        }
        List<AudioSnapshot> snapshots = new ArrayList<>();
        Future<?> flusher = pool.submit(() -> {
            start.await();
            for (int i = 0; i < 50; i++) {
                try {
                    snapshots.add(recorder.flush());
                } catch (NoAudioException e) {
                    Thread.yield();
                }
            }
            return null;
        });

        // Act
        start.countDown();
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        flusher.get(10, TimeUnit.SECONDS);
        pool.shutdown();
        if (recorder.hasAudio()) {
            snapshots.add(recorder.flush());
        }

        // Assert
        long total = snapshots.stream().mapToLong(AudioSnapshot::totalBytes).sum();
        assertThat(total).isEqualTo((long) writers * perWriter);
    }

    private static byte[] bytes(int marker) {
        return new byte[] {(byte) marker, 0, 0};
    }
}
