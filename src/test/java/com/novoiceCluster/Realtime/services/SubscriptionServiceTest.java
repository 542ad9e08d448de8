package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.InterestGroup;
import com.novoiceCluster.Realtime.support.InMemoryMembershipDirectory;
import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionServiceTest {

    private final InMemoryMembershipDirectory directory = new InMemoryMembershipDirectory()
            .server("s1", "owner", "alice")
            .server("s2", "owner2")
            .textChannel("t1", "s1")
            .textChannel("t2", "s2");
    private final InterestGroupRegistry groups = new InterestGroupRegistry();
    private final SubscriptionService subscriptions = new SubscriptionService(groups, directory);

    private final Connection alice = Connection.of("c-alice", new AuthenticatedUser("alice", "alice"), Instant.EPOCH);

    @Test
    void member_may_join_server_and_channel_groups() {
        assertThat(subscriptions.subscribe(alice, "server:s1")).isTrue();
        assertThat(subscriptions.subscribe(alice, "channel:t1")).isTrue();

        assertThat(groups.isMember("c-alice", InterestGroup.server("s1"))).isTrue();
        assertThat(groups.isMember("c-alice", InterestGroup.channel("t1"))).isTrue();
    }

    @Test
    void unauthorized_subscribe_is_silently_ignored() {
        assertThat(subscriptions.subscribe(alice, "server:s2")).isFalse();
        assertThat(subscriptions.subscribe(alice, "channel:t2")).isFalse();
        assertThat(subscriptions.subscribe(alice, "channel:missing")).isFalse();

        assertThat(groups.members(InterestGroup.server("s2"))).isEmpty();
        assertThat(groups.members(InterestGroup.channel("t2"))).isEmpty();
    }

    @Test
    void server_managed_and_malformed_groups_cannot_be_requested() {
        assertThat(subscriptions.subscribe(alice, "user:bob")).isFalse();
        assertThat(subscriptions.subscribe(alice, "voice:v1")).isFalse();
        assertThat(subscriptions.subscribe(alice, "s1")).isFalse();
        assertThat(subscriptions.subscribe(alice, null)).isFalse();
        assertThat(subscriptions.unsubscribe(alice, "user:alice")).isFalse();

        assertThat(groups.members(InterestGroup.user("bob"))).isEmpty();
    }

    @Test
    void unsubscribe_leaves_the_group() {
        subscriptions.subscribe(alice, "server:s1");

        assertThat(subscriptions.unsubscribe(alice, "server:s1")).isTrue();

        assertThat(groups.isMember("c-alice", InterestGroup.server("s1"))).isFalse();
    }
}
