package com.example.cardlobby.delivery;

import java.util.Objects;

/** Either every connection of a room or one connection. */
public record EventTarget(Kind kind, String id) {

    public enum Kind { ROOM, CONNECTION }

    private static final String ROOM_PREFIX = "room:";
    private static final String SOCKET_PREFIX = "socket:";

    public EventTarget {
        Objects.requireNonNull(kind, "kind");
        if (id == null || id.isBlank()) throw new IllegalArgumentException("target id must not be blank");
    }

    public static EventTarget room(String gameId) {
        return new EventTarget(Kind.ROOM, gameId);
    }

    public static EventTarget connection(String connectionId) {
        return new EventTarget(Kind.CONNECTION, connectionId);
    }

    /** "room:&lt;id&gt;", "socket:&lt;id&gt;", or a bare room id. */
    public static EventTarget parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("target must not be blank");
        String s = raw.trim();
        if (s.startsWith(SOCKET_PREFIX)) return connection(s.substring(SOCKET_PREFIX.length()));
        if (s.startsWith(ROOM_PREFIX)) return room(s.substring(ROOM_PREFIX.length()));
        return room(s);
    }

    @Override
    public String toString() {
        return (kind == Kind.ROOM ? ROOM_PREFIX : SOCKET_PREFIX) + id;
    }
}
