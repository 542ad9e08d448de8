package com.novoiceCluster.Realtime.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IceConfiguration {

    public static final String CREDENTIAL_NONE = "none";
    public static final String CREDENTIAL_HMAC = "hmac-sha1";
    public static final String CREDENTIAL_STATIC = "static";
    public static final String CREDENTIAL_MISSING = "missing-turn-credentials";

    boolean turnEnabled;
    String credentialType;
    Integer ttlSeconds;
    /** Epoch seconds. */
    Long expiresAt;
    List<IceServer> iceServers;
}
