package com.example.cardlobby.error;

import java.util.Map;

/** No live room with this id. */
public class RoomNotFoundException extends LobbyException {

    public RoomNotFoundException(String gameId) {
        super("ROOM_NOT_FOUND", "Room " + gameId + " does not exist", Map.of("gameId", gameId), null);
    }
}
