package com.phillippitts.insightbot.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisResultTest {

    @Test
    void successRequiresReport() {
        assertThatThrownBy(() -> AnalysisResult.success(null)).isInstanceOf(NullPointerException.class);
        assertThat(AnalysisResult.success("r").isSuccess()).isTrue();
    }

    @Test
    void failureResultsAreNotSuccess() {
        assertThat(AnalysisResult.noAudio().isSuccess()).isFalse();
        assertThat(AnalysisResult.rateLimited().status()).isEqualTo(AnalysisResult.Status.RATE_LIMITED);
        assertThat(AnalysisResult.transientError("boom").message()).isEqualTo("boom");
    }

    @Test
    void snapshotDropsSpeakersWithoutFragmentsAndIsImmutable() {
        Map<Long, List<byte[]>> fragments = new HashMap<>();
        fragments.put(1L, List.of(new byte[] {1, 2}));
        fragments.put(2L, List.of());

        AudioSnapshot snapshot = new AudioSnapshot(1L, 0L, Instant.EPOCH, 1, fragments);
        fragments.put(3L, List.of(new byte[] {3}));

        assertThat(snapshot.speakerCount()).isEqualTo(1);
        assertThat(snapshot.totalBytes()).isEqualTo(2);
        assertThatThrownBy(() -> snapshot.fragments().put(4L, List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void settingsCopiesReplaceOneField() {
        GuildSettings settings = new GuildSettings(1L, AnalysisMode.DEBATE, 300);

        assertThat(settings.withMode(AnalysisMode.SUMMARY)).isEqualTo(new GuildSettings(1L, AnalysisMode.SUMMARY, 300));
        assertThat(settings.withIntervalSeconds(60).intervalSeconds()).isEqualTo(60);
    }
}
