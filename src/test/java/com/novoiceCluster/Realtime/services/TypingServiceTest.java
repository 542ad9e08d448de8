package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.EventType;
import com.novoiceCluster.Realtime.model.TypingRequest;
import com.novoiceCluster.Realtime.model.TypingUpdate;
import com.novoiceCluster.Realtime.support.RealtimeHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TypingServiceTest {

    private RealtimeHarness harness;
    private Connection alice;

    @BeforeEach
    void setUp() {
        harness = new RealtimeHarness();
        alice = harness.connect("c-alice", "alice");
        harness.connect("c-alice-phone", "alice");
        harness.connect("c-bob", "bob");
        harness.connect("c-mallory", "mallory");
        harness.events.clear();
    }

    @Test
    void direct_typing_goes_to_the_target_only() {
        assertThat(harness.typing.relay(alice, new TypingRequest(null, "bob", true), true)).isTrue();

        TypingUpdate update = harness.events.lastPayload("c-bob", EventType.TYPING_UPDATE, TypingUpdate.class);
        assertThat(update.getUserId()).isEqualTo("alice");
        assertThat(update.getDisplayName()).isEqualTo("Alice");
        assertThat(update.getChannelId()).isEqualTo("bob");
        assertThat(update.isDirect()).isTrue();
        assertThat(update.isTyping()).isTrue();
        assertThat(harness.events.all()).hasSize(1);
    }

    @Test
    void channel_typing_goes_to_server_group_except_the_sending_connection() {
        harness.typing.relay(alice, new TypingRequest("t1", null, false), false);

        assertThat(harness.events.eventsFor("c-bob", EventType.TYPING_UPDATE)).hasSize(1);
        assertThat(harness.events.eventsFor("c-alice-phone", EventType.TYPING_UPDATE)).hasSize(1);
        assertThat(harness.events.eventsFor("c-alice")).isEmpty();
        assertThat(harness.events.eventsFor("c-mallory")).isEmpty();

        TypingUpdate update = harness.events.lastPayload("c-bob", EventType.TYPING_UPDATE, TypingUpdate.class);
        assertThat(update.getChannelId()).isEqualTo("t1");
        assertThat(update.isTyping()).isFalse();
    }

    @Test
    void non_member_and_unknown_channel_are_dropped() {
        Connection mallory = harness.connections.require("c-mallory");

        assertThat(harness.typing.relay(mallory, new TypingRequest("t1", null, false), true)).isFalse();
        assertThat(harness.typing.relay(alice, new TypingRequest("missing", null, false), true)).isFalse();
        assertThat(harness.typing.relay(alice, new TypingRequest(null, null, true), true)).isFalse();

        assertThat(harness.events.all()).isEmpty();
    }
}
