package com.phillippitts.insightbot.service.capture;

import com.phillippitts.insightbot.exception.VoiceCaptureException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class BridgedVoiceCaptureServiceTest {

    private final BridgedVoiceCaptureService service = new BridgedVoiceCaptureService();

    @Test
    void routesFragmentsAndNamesToJoinedSink() {
        AudioFrameSink sink = mock(AudioFrameSink.class);
        service.join(1L, 20L, sink);
        byte[] fragment = {1, 2};

        assertThat(service.deliverFragment(1L, 5L, fragment)).isTrue();
        assertThat(service.identifySpeaker(1L, 5L, "Alice")).isTrue();

        verify(sink).onFragment(5L, fragment);
        verify(sink).onSpeakerIdentified(5L, "Alice");
    }

    @Test
    void rejectsEventsForGuildWithoutCapture() {
        assertThat(service.deliverFragment(1L, 5L, new byte[] {1})).isFalse();
        assertThat(service.identifySpeaker(1L, 5L, "Alice")).isFalse();
    }

    @Test
    void closedHandleStopsDelivery() {
        AudioFrameSink sink = mock(AudioFrameSink.class);
        VoiceCaptureHandle handle = service.join(1L, 20L, sink);

        handle.close();

        assertThat(handle.isOpen()).isFalse();
        assertThat(service.isJoined(1L)).isFalse();
        assertThat(service.deliverFragment(1L, 5L, new byte[] {1})).isFalse();
        verify(sink, never()).onFragment(anyLong(), any());
    }

    @Test
    void secondJoinForSameGuildFails() {
        service.join(1L, 20L, mock(AudioFrameSink.class));

        assertThatThrownBy(() -> service.join(1L, 21L, mock(AudioFrameSink.class)))
                .isInstanceOf(VoiceCaptureException.class);
    }

    @Test
    void staleHandleCloseDoesNotRemoveNewerCapture() {
        VoiceCaptureHandle first = service.join(1L, 20L, mock(AudioFrameSink.class));
        first.close();
        service.join(1L, 20L, mock(AudioFrameSink.class));

        first.close();

        assertThat(service.isJoined(1L)).isTrue();
    }
}
