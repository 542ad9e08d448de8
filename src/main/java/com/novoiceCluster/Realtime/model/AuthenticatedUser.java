package com.novoiceCluster.Realtime.model;

import lombok.Value;

import java.security.Principal;

/**
 * Identity extracted from a verified session token.
 *
 * Used as the STOMP session principal, so {@link #getName()} must return the user id:
 * user destinations ({@code /user/queue/events}) are resolved by principal name.
 */
@Value
public class AuthenticatedUser implements Principal {

    String userId;
    String username;

    @Override
    public String getName() {
        return userId;
    }
}
