package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.Exception.FailureKind;
import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.config.RealtimeProperties;
import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.MusicCommand;
import com.novoiceCluster.Realtime.model.SourceKind;
import com.novoiceCluster.Realtime.model.Track;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackNormalizerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final TrackNormalizer normalizer = new TrackNormalizer(new RealtimeProperties());
    private final Connection alice = Connection.of("c1", new AuthenticatedUser("alice", "alice"), NOW);

    @ParameterizedTest
    @ValueSource(strings = {
            "https://youtu.be/dQw4w9WgXcQ",
            "https://www.youtube.com/watch?v=dQw4w9WgXcQ&t=42",
            "https://m.youtube.com/watch?v=dQw4w9WgXcQ",
            "https://www.youtube.com/shorts/dQw4w9WgXcQ",
            "https://www.youtube.com/embed/dQw4w9WgXcQ"
    })
    void youtube_links_are_reduced_to_canonical_form(String url) {
        Track track = normalizer.normalize(command(url, null), alice, NOW);

        assertThat(track.getSource()).isEqualTo(SourceKind.YOUTUBE);
        assertThat(track.getUrl()).isEqualTo("https://www.youtube.com/watch?v=dQw4w9WgXcQ");
        assertThat(track.getCoverUrl()).isEqualTo("https://img.youtube.com/vi/dQw4w9WgXcQ/hqdefault.jpg");
        assertThat(track.getTitle()).isEqualTo("YouTube Video");
    }

    @Test
    void supplied_cover_and_title_win_over_synthesized_ones() {
        MusicCommand command = command("https://youtu.be/dQw4w9WgXcQ", "  Never   Gonna  ");
        command.setCoverUrl("https://cdn.example.com/cover.png");

        Track track = normalizer.normalize(command, alice, NOW);

        assertThat(track.getTitle()).isEqualTo("Never Gonna");
        assertThat(track.getCoverUrl()).isEqualTo("https://cdn.example.com/cover.png");
    }

    @Test
    void youtube_link_without_video_id_is_rejected() {
        assertThatThrownBy(() -> normalizer.normalize(command("https://www.youtube.com/feed/trending", null), alice, NOW))
                .isInstanceOf(RealtimeException.class)
                .extracting("kind").isEqualTo(FailureKind.VALIDATION);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ftp://example.com/song.mp3", "not a url", "javascript:alert(1)", ""})
    void non_http_links_are_rejected(String url) {
        assertThatThrownBy(() -> normalizer.normalize(command(url, null), alice, NOW))
                .isInstanceOf(RealtimeException.class)
                .extracting("kind").isEqualTo(FailureKind.VALIDATION);
    }

    @Test
    void direct_link_title_is_inferred_from_path() {
        Track track = normalizer.normalize(command("https://files.example.com/music/my_song-final.mp3", null), alice, NOW);

        assertThat(track.getSource()).isEqualTo(SourceKind.DIRECT);
        assertThat(track.getSourceLabel()).isEqualTo("Audio Link");
        assertThat(track.getTitle()).isEqualTo("my song final");
        assertThat(track.getCoverUrl()).isNull();
        assertThat(track.getRequestedBy()).isEqualTo("alice");
        assertThat(track.getAddedAt()).isEqualTo(NOW);
        assertThat(track.getId()).isNotBlank();
    }

    @Test
    void bare_host_falls_back_to_hostname_title() {
        Track track = normalizer.normalize(command("https://www.soundcloud.com/", null), alice, NOW);

        assertThat(track.getSource()).isEqualTo(SourceKind.SOUNDCLOUD);
        assertThat(track.getTitle()).isEqualTo("soundcloud.com");
    }

    @Test
    void durations_are_clamped_and_rounded() {
        MusicCommand command = command("https://example.com/a.mp3", null);
        command.setDurationSeconds(183.12345);
        assertThat(normalizer.normalize(command, alice, NOW).getDurationSeconds()).isEqualTo(183.123);

        command.setDurationSeconds(100_000.0);
        assertThat(normalizer.normalize(command, alice, NOW).getDurationSeconds()).isEqualTo(43200.0);

        command.setDurationSeconds(Double.NaN);
        assertThat(normalizer.normalize(command, alice, NOW).getDurationSeconds()).isNull();
    }

    @Test
    void long_titles_are_capped() {
        String title = "x".repeat(500);

        Track track = normalizer.normalize(command("https://example.com/a.mp3", title), alice, NOW);

        assertThat(track.getTitle()).hasSize(TrackNormalizer.MAX_LABEL_LENGTH);
    }

    private static MusicCommand command(String url, String title) {
        MusicCommand command = new MusicCommand();
        command.setChannelId("v1");
        command.setUrl(url);
        command.setTitle(title);
        return command;
    }
}
