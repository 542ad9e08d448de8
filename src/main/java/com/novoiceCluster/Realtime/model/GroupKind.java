package com.novoiceCluster.Realtime.model;

/**
 * Kinds of interest group. Only SERVER and CHANNEL groups may be joined or left on request;
 * USER and VOICE membership is managed by the server.
 */
public enum GroupKind {
    USER("user", false),
    SERVER("server", true),
    CHANNEL("channel", true),
    VOICE("voice", false);

    private final String prefix;
    private final boolean clientManaged;

    GroupKind(String prefix, boolean clientManaged) {
        this.prefix = prefix;
        this.clientManaged = clientManaged;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isClientManaged() {
        return clientManaged;
    }

    public static GroupKind fromPrefix(String prefix) {
        for (GroupKind kind : values()) {
            if (kind.prefix.equals(prefix)) {
                return kind;
            }
        }
        return null;
    }
}
