package com.novoiceCluster.Realtime.model;

import com.novoiceCluster.Realtime.Exception.FailureKind;
import com.novoiceCluster.Realtime.Exception.RealtimeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PlaybackSessionTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final Mutator ALICE = new Mutator("alice", "Alice");
    private static final Mutator BOB = new Mutator("bob", "Bob");

    private PlaybackSession session;

    @BeforeEach
    void setUp() {
        session = new PlaybackSession("v1", 3, 43200, 5, T0);
    }

    @Test
    void derived_position_adds_elapsed_time_while_playing() {
        session.enqueue(track("a", 300.0), ALICE, T0);
        session.seek(10, ALICE, T0);
        session.play(ALICE, T0);

        assertThat(session.positionAt(T0.plusSeconds(5))).isEqualTo(15.0);
        assertThat(session.snapshot(T0.plusSeconds(5)).getPositionSeconds()).isEqualTo(15.0);
    }

    @Test
    void derived_position_is_clamped_to_known_track_duration() {
        session.enqueue(track("a", 30.0), ALICE, T0);
        session.play(ALICE, T0);

        assertThat(session.positionAt(T0.plusSeconds(45))).isEqualTo(30.0);
    }

    @Test
    void position_is_frozen_while_paused() {
        session.enqueue(track("a", null), ALICE, T0);
        session.seek(42, ALICE, T0);

        assertThat(session.positionAt(T0.plusSeconds(600))).isEqualTo(42.0);
    }

    @Test
    void play_twice_reports_change_once() {
        session.enqueue(track("a", null), ALICE, T0);

        assertThat(session.play(ALICE, T0)).isTrue();
        assertThat(session.play(BOB, T0.plusSeconds(1))).isFalse();
        assertThat(session.getLastMutatedBy()).isEqualTo(ALICE);
    }

    @Test
    void play_without_current_track_is_rejected() {
        assertThatThrownBy(() -> session.play(ALICE, T0))
                .isInstanceOf(RealtimeException.class)
                .extracting("kind").isEqualTo(FailureKind.VALIDATION);
    }

    @Test
    void end_to_end_enqueue_play_pause_next_and_track_ended() {
        Track a = track("a", null);
        Track b = track("b", null);

        session.enqueue(a, ALICE, T0);
        assertThat(session.getQueue()).containsExactly(a);
        assertThat(session.getCurrentIndex()).isZero();
        assertThat(session.getState()).isEqualTo(PlaybackState.PAUSED);
        assertThat(session.positionAt(T0)).isZero();

        session.play(ALICE, T0);
        assertThat(session.getState()).isEqualTo(PlaybackState.PLAYING);
        assertThat(session.getAnchor()).isEqualTo(T0);

        Instant t3 = T0.plusSeconds(3);
        session.pause(ALICE, t3);
        assertThat(session.getState()).isEqualTo(PlaybackState.PAUSED);
        assertThat(session.getBasePositionSeconds()).isCloseTo(3.0, within(0.001));

        session.enqueue(b, BOB, t3);
        assertThat(session.getQueue()).containsExactly(a, b);
        assertThat(session.getCurrentIndex()).isZero();

        session.next(BOB, t3);
        assertThat(session.getCurrentIndex()).isEqualTo(1);
        assertThat(session.positionAt(t3)).isZero();
        assertThat(session.getState()).isEqualTo(PlaybackState.PAUSED);

        assertThat(session.trackEnded(b.getId(), BOB, t3)).isTrue();
        assertThat(session.getCurrentIndex()).isEqualTo(1);
        assertThat(session.getState()).isEqualTo(PlaybackState.IDLE);
        assertThat(session.positionAt(t3)).isZero();
    }

    @Test
    void removing_track_before_current_keeps_same_track_current() {
        Track a = track("a", null);
        Track b = track("b", null);
        Track c = track("c", null);
        session.enqueue(a, ALICE, T0);
        session.enqueue(b, ALICE, T0);
        session.enqueue(c, ALICE, T0);
        session.setCurrent(c.getId(), ALICE, T0);
        session.seek(20, ALICE, T0);

        session.remove(a.getId(), ALICE, T0);

        assertThat(session.getCurrentTrack()).isEqualTo(c);
        assertThat(session.getCurrentIndex()).isEqualTo(1);
        assertThat(session.getBasePositionSeconds()).isEqualTo(20.0);
    }

    @Test
    void removing_current_track_resets_position_and_clamps_pointer() {
        Track a = track("a", null);
        Track b = track("b", null);
        session.enqueue(a, ALICE, T0);
        session.enqueue(b, ALICE, T0);
        session.setCurrent(b.getId(), ALICE, T0);
        session.seek(20, ALICE, T0);

        session.remove(b.getId(), ALICE, T0);

        assertThat(session.getCurrentTrack()).isEqualTo(a);
        assertThat(session.getBasePositionSeconds()).isZero();
        assertThat(session.getState()).isEqualTo(PlaybackState.PAUSED);
    }

    @Test
    void removing_last_track_goes_idle() {
        Track a = track("a", null);
        session.enqueue(a, ALICE, T0);
        session.play(ALICE, T0);

        session.remove(a.getId(), ALICE, T0.plusSeconds(2));

        assertThat(session.getCurrentIndex()).isNull();
        assertThat(session.getState()).isEqualTo(PlaybackState.IDLE);
    }

    @Test
    void removing_unknown_track_is_rejected() {
        session.enqueue(track("a", null), ALICE, T0);

        assertThatThrownBy(() -> session.remove("missing", ALICE, T0))
                .isInstanceOf(RealtimeException.class)
                .extracting("kind").isEqualTo(FailureKind.VALIDATION);
    }

    @Test
    void previous_restarts_current_track_after_threshold() {
        Track a = track("a", null);
        Track b = track("b", null);
        session.enqueue(a, ALICE, T0);
        session.enqueue(b, ALICE, T0);
        session.setCurrent(b.getId(), ALICE, T0);
        session.play(ALICE, T0);

        session.previous(ALICE, T0.plusSeconds(8));

        assertThat(session.getCurrentTrack()).isEqualTo(b);
        assertThat(session.positionAt(T0.plusSeconds(8))).isZero();
        assertThat(session.getState()).isEqualTo(PlaybackState.PLAYING);
    }

    @Test
    void previous_steps_back_within_threshold() {
        Track a = track("a", null);
        Track b = track("b", null);
        session.enqueue(a, ALICE, T0);
        session.enqueue(b, ALICE, T0);
        session.setCurrent(b.getId(), ALICE, T0);
        session.play(ALICE, T0);

        session.previous(ALICE, T0.plusSeconds(2));

        assertThat(session.getCurrentTrack()).isEqualTo(a);
        assertThat(session.positionAt(T0.plusSeconds(2))).isZero();
    }

    @Test
    void enqueue_beyond_capacity_is_rejected_without_change() {
        session.enqueue(track("a", null), ALICE, T0);
        session.enqueue(track("b", null), ALICE, T0);
        session.enqueue(track("c", null), ALICE, T0);

        assertThatThrownBy(() -> session.enqueue(track("d", null), BOB, T0))
                .isInstanceOf(RealtimeException.class)
                .extracting("kind").isEqualTo(FailureKind.CAPACITY);
        assertThat(session.getQueue()).hasSize(3);
        assertThat(session.getLastMutatedBy()).isEqualTo(ALICE);
    }

    @Test
    void stale_track_ended_is_ignored() {
        Track a = track("a", null);
        Track b = track("b", null);
        session.enqueue(a, ALICE, T0);
        session.enqueue(b, ALICE, T0);
        session.next(ALICE, T0);

        assertThat(session.trackEnded(a.getId(), BOB, T0.plusSeconds(1))).isFalse();
        assertThat(session.getCurrentTrack()).isEqualTo(b);
    }

    @Test
    void report_duration_back_fills_once_without_attribution() {
        Track a = track("a", null);
        session.enqueue(a, ALICE, T0);

        assertThat(session.reportDuration(a.getId(), 215.5)).isTrue();
        assertThat(session.reportDuration(a.getId(), 300)).isFalse();
        assertThat(session.reportDuration("gone", 10)).isFalse();

        assertThat(session.getCurrentTrack().getDurationSeconds()).isEqualTo(215.5);
        assertThat(session.getLastMutatedBy()).isEqualTo(ALICE);
    }

    @Test
    void seek_from_idle_is_rejected_without_current_track() {
        assertThatThrownBy(() -> session.seek(5, ALICE, T0))
                .isInstanceOf(RealtimeException.class);
    }

    @Test
    void seek_is_clamped_to_bounds() {
        session.enqueue(track("a", 120.0), ALICE, T0);

        session.seek(-3, ALICE, T0);
        assertThat(session.getBasePositionSeconds()).isZero();

        session.seek(500, ALICE, T0);
        assertThat(session.getBasePositionSeconds()).isEqualTo(120.0);
    }

    @Test
    void clear_on_empty_session_is_a_no_op() {
        assertThat(session.clear(ALICE, T0)).isFalse();

        session.enqueue(track("a", null), ALICE, T0);
        assertThat(session.clear(ALICE, T0)).isTrue();
        assertThat(session.getQueue()).isEmpty();
        assertThat(session.getState()).isEqualTo(PlaybackState.IDLE);
    }

    @Test
    void next_at_end_of_queue_goes_idle_only_once() {
        session.enqueue(track("a", null), ALICE, T0);
        session.play(ALICE, T0);

        assertThat(session.next(ALICE, T0.plusSeconds(4))).isTrue();
        assertThat(session.getState()).isEqualTo(PlaybackState.IDLE);
        assertThat(session.getCurrentIndex()).isZero();
        assertThat(session.next(ALICE, T0.plusSeconds(5))).isFalse();
    }

    private static Track track(String id, Double durationSeconds) {
        return Track.builder()
                .id(id)
                .url("https://example.com/" + id + ".mp3")
                .title(id)
                .source(SourceKind.DIRECT)
                .sourceLabel(SourceKind.DIRECT.getLabel())
                .durationSeconds(durationSeconds)
                .requestedBy("alice")
                .requestedByName("Alice")
                .addedAt(T0)
                .build();
    }
}
