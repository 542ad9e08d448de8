package com.novoiceCluster.Realtime.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a queued track is played from. Everything except DIRECT is an embeddable provider.
 */
public enum SourceKind {
    SPOTIFY("spotify", "Spotify"),
    YOUTUBE("youtube", "YouTube"),
    SOUNDCLOUD("soundcloud", "SoundCloud"),
    BANDCAMP("bandcamp", "Bandcamp"),
    MIXCLOUD("mixcloud", "Mixcloud"),
    DIRECT("direct", "Audio Link");

    private final String wireName;
    private final String label;

    SourceKind(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getLabel() {
        return label;
    }

    public boolean isEmbeddable() {
        return this != DIRECT;
    }

    /**
     * Infer the source from a hostname. Matching is by substring, so subdomains
     * ({@code m.youtube.com}, {@code open.spotify.com}) resolve too.
     */
    public static SourceKind fromHost(String hostname) {
        String host = hostname == null ? "" : hostname.toLowerCase();
        if (host.contains("spotify")) return SPOTIFY;
        if (host.contains("youtube") || host.contains("youtu.be")) return YOUTUBE;
        if (host.contains("soundcloud")) return SOUNDCLOUD;
        if (host.contains("bandcamp")) return BANDCAMP;
        if (host.contains("mixcloud")) return MIXCLOUD;
        return DIRECT;
    }
}
