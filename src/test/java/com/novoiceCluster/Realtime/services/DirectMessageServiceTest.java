package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.Exception.FailureKind;
import com.novoiceCluster.Realtime.Exception.RealtimeException;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.DirectMessage;
import com.novoiceCluster.Realtime.model.DirectMessageDelivery;
import com.novoiceCluster.Realtime.model.DirectMessageRequest;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.PendingDirectMessage;
import com.novoiceCluster.Realtime.support.RealtimeHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

class DirectMessageServiceTest {

    private RealtimeHarness harness;
    private DirectMessageService directMessages;
    private Connection alice;

    @BeforeEach
    void setUp() {
        harness = new RealtimeHarness();
        directMessages = harness.directMessages;
        alice = harness.connect("c-alice", "alice");
        harness.events.clear();
    }

    @Test
    void online_recipient_gets_live_delivery_and_nothing_is_stored() {
        harness.connect("c-bob", "bob");
        harness.events.clear();

        DirectMessage sent = directMessages.send(alice, new DirectMessageRequest("bob", "  hello bob  "));

        DirectMessageDelivery delivery = harness.events.lastPayload("c-bob", EventType.DM_NEW, DirectMessageDelivery.class);
        assertThat(delivery.getMessage().getContent()).isEqualTo("hello bob");
        assertThat(delivery.getMessage().getSenderDisplayName()).isEqualTo("Alice");
        assertThat(delivery.getMessage().getSenderAvatarColor()).isEqualTo("#ff0000");
        assertThat(delivery.getWasPending()).isNull();
        assertThat(harness.pendingStore.all()).isEmpty();
        // echoed to the sender's own connections
        assertThat(harness.events.lastPayload("c-alice", EventType.DM_NEW, DirectMessageDelivery.class).getMessage().getId())
                .isEqualTo(sent.getId());
    }

    @Test
    void offline_round_trip_stores_once_and_delivers_exactly_once() {
        DirectMessage sent = directMessages.send(alice, new DirectMessageRequest("bob", "are you there?"));

        assertThat(harness.pendingStore.all()).hasSize(1);
        PendingDirectMessage stored = harness.pendingStore.all().get(0);
        assertThat(stored.getId()).isEqualTo(sent.getId());
        assertThat(stored.getExpiresAt()).isEqualTo(RealtimeHarness.START.plus(Duration.ofDays(7)));

        harness.clock.advance(Duration.ofHours(5));
        harness.connect("c-bob", "bob");

        assertThat(harness.events.eventsFor("c-bob", EventType.DM_NEW)).hasSize(1);
        DirectMessageDelivery delivery = harness.events.lastPayload("c-bob", EventType.DM_NEW, DirectMessageDelivery.class);
        assertThat(delivery.getWasPending()).isTrue();
        assertThat(delivery.getMessage().getContent()).isEqualTo("are you there?");
        assertThat(harness.pendingStore.all()).isEmpty();

        harness.connect("c-bob-phone", "bob");
        assertThat(harness.events.eventsFor("c-bob-phone", EventType.DM_NEW)).isEmpty();
    }

    @Test
    void expired_pending_messages_are_not_delivered_and_are_removed() {
        directMessages.send(alice, new DirectMessageRequest("bob", "too late"));

        harness.clock.advance(Duration.ofDays(8));
        harness.connect("c-bob", "bob");

        assertThat(harness.events.eventsFor("c-bob", EventType.DM_NEW)).isEmpty();
        assertThat(harness.pendingStore.all()).isEmpty();
    }

    @Test
    void retried_insert_is_idempotent() {
        DirectMessage sent = directMessages.send(alice, new DirectMessageRequest("bob", "once"));
        PendingDirectMessage retry = PendingDirectMessage.of(sent, RealtimeHarness.START.plus(Duration.ofDays(7)));

        assertThat(harness.pendingStore.insertIfAbsent(retry)).isFalse();
        assertThat(harness.pendingStore.all()).hasSize(1);
    }

    @Test
    void empty_and_oversized_content_are_rejected() {
        assertThatThrownBy(() -> directMessages.send(alice, new DirectMessageRequest("bob", "   ")))
                .isInstanceOf(RealtimeException.class)
                .extracting("kind").isEqualTo(FailureKind.VALIDATION);

        String tooLong = "a".repeat(harness.properties.getMaxMessageLength() + 1);
        assertThatThrownBy(() -> directMessages.send(alice, new DirectMessageRequest("bob", tooLong)))
                .isInstanceOf(RealtimeException.class)
                .extracting("kind").isEqualTo(FailureKind.VALIDATION);

        assertThat(harness.pendingStore.all()).isEmpty();
        assertThat(harness.events.all()).isEmpty();
    }

    @Test
    void rate_limited_sender_gets_capacity_error() {
        when(harness.rateLimiter.tryAcquire("alice")).thenReturn(false);

        assertThatThrownBy(() -> directMessages.send(alice, new DirectMessageRequest("bob", "spam")))
                .isInstanceOf(RealtimeException.class)
                .extracting("kind").isEqualTo(FailureKind.CAPACITY);
        assertThat(harness.pendingStore.all()).isEmpty();
    }
}
