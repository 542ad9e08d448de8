package com.novoiceCluster.Realtime.model;

import lombok.Value;

/**
 * Live notice that someone sent the recipient a friend request. The request itself is
 * persisted by the main application; this only tells open clients to refresh.
 */
@Value
public class FriendRequestNotice {
    String from;
    String username;
    String displayName;
    String avatarColor;

    public static FriendRequestNotice from(Participant sender) {
        return new FriendRequestNotice(sender.getUserId(), sender.getUsername(),
                sender.getDisplayName(), sender.getAvatarColor());
    }
}
