package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.AuthenticatedUser;

/**
 * Verifies a session token presented at the WebSocket handshake or on a REST call.
 */
public interface TokenVerifier {

    /**
     * @throws com.novoiceCluster.Realtime.Exception.RealtimeException of kind AUTHENTICATION
     *         when the token is missing, forged or expired
     */
    AuthenticatedUser verify(String token);
}
