package com.novoiceCluster.Realtime.support;

import com.novoiceCluster.Realtime.config.RealtimeProperties;
import com.novoiceCluster.Realtime.model.AuthenticatedUser;
import com.novoiceCluster.Realtime.model.Connection;
import com.novoiceCluster.Realtime.model.VoiceRoomClosedEvent;
import com.novoiceCluster.Realtime.model.VoiceRoomJoinedEvent;
import com.novoiceCluster.Realtime.services.ConnectionRegistry;
import com.novoiceCluster.Realtime.services.DirectMessageService;
import com.novoiceCluster.Realtime.services.EventBroadcaster;
import com.novoiceCluster.Realtime.services.FriendRequestRelay;
import com.novoiceCluster.Realtime.services.InterestGroupRegistry;
import com.novoiceCluster.Realtime.services.KeyedLocks;
import com.novoiceCluster.Realtime.services.MessageRateLimiter;
import com.novoiceCluster.Realtime.services.MusicSessionService;
import com.novoiceCluster.Realtime.services.RealtimeSessionService;
import com.novoiceCluster.Realtime.services.SignalingRelay;
import com.novoiceCluster.Realtime.services.SubscriptionService;
import com.novoiceCluster.Realtime.services.TrackNormalizer;
import com.novoiceCluster.Realtime.services.TypingService;
import com.novoiceCluster.Realtime.services.VoiceRoomCoordinator;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The real-time core wired by hand over in-memory collaborators, the way the Spring context
 * wires it over Redis and STOMP.
 *
 * Directory fixture: server {@code s1} owned by {@code owner} with members {@code alice},
 * {@code bob}, {@code carol}; voice channels {@code v1} and {@code v2}; text channel {@code t1}.
 * {@code mallory} belongs to no server.
 */
public class RealtimeHarness {

    public static final Instant START = Instant.parse("2026-03-01T12:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final RealtimeProperties properties = new RealtimeProperties();
    public final InMemoryMembershipDirectory directory = new InMemoryMembershipDirectory()
            .server("s1", "owner", "alice", "bob", "carol")
            .voiceChannel("v1", "s1")
            .voiceChannel("v2", "s1")
            .textChannel("t1", "s1")
            .user("alice", "Alice", "#ff0000")
            .user("bob", "Bob", "#00ff00");
    public final InMemoryPendingMessageStore pendingStore = new InMemoryPendingMessageStore();
    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final MessageRateLimiter rateLimiter = mock(MessageRateLimiter.class);

    public final ConnectionRegistry connections = new ConnectionRegistry();
    public final InterestGroupRegistry groups = new InterestGroupRegistry();
    public final KeyedLocks locks = new KeyedLocks();
    public final EventBroadcaster broadcaster = new EventBroadcaster(connections, groups, events, clock);

    public final VoiceRoomCoordinator voiceRooms;
    public final SignalingRelay signalingRelay;
    public final MusicSessionService music;
    public final DirectMessageService directMessages;
    public final SubscriptionService subscriptions;
    public final TypingService typing;
    public final FriendRequestRelay friendRequests;
    public final RealtimeSessionService sessions;

    public RealtimeHarness() {
        when(rateLimiter.tryAcquire(anyString())).thenReturn(true);

        voiceRooms = new VoiceRoomCoordinator(directory, connections, groups, broadcaster, locks,
                this::dispatchRoomEvent);
        signalingRelay = new SignalingRelay(voiceRooms, broadcaster, locks);
        music = new MusicSessionService(voiceRooms, directory, new TrackNormalizer(properties),
                broadcaster, locks, properties, clock);
        directMessages = new DirectMessageService(connections, pendingStore, rateLimiter, directory,
                broadcaster, locks, properties, clock);
        subscriptions = new SubscriptionService(groups, directory);
        typing = new TypingService(directory, broadcaster);
        friendRequests = new FriendRequestRelay(directory, rateLimiter, broadcaster);
        sessions = new RealtimeSessionService(connections, groups, directory, voiceRooms,
                directMessages, broadcaster, locks);
    }

    /**
     * Attach a new connection, as the events subscription would.
     */
    public Connection connect(String connectionId, String userId) {
        Connection connection = Connection.of(connectionId, new AuthenticatedUser(userId, userId), clock.instant());
        sessions.attach(connection);
        return connection;
    }

    public void disconnect(Connection connection) {
        sessions.detach(connection.getConnectionId());
    }

    private void dispatchRoomEvent(Object event) {
        if (event instanceof VoiceRoomJoinedEvent) {
            music.onRoomJoined((VoiceRoomJoinedEvent) event);
        } else if (event instanceof VoiceRoomClosedEvent) {
            music.onRoomClosed((VoiceRoomClosedEvent) event);
        }
    }
}
