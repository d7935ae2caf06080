package com.example.cardlobby.session;

import com.example.cardlobby.model.GameMode;
import com.example.cardlobby.model.PlayerSession;
import com.example.cardlobby.model.RoomSession;

import java.util.List;

/**
 * Start eligibility of a room. Must be computed under the room lock.
 * {@code allReady} requires at least two connected players, all of them ready.
 */
public record Readiness(
        int totalPlayers,
        int connectedPlayers,
        int readyCount,
        boolean allReady,
        boolean teamsFormed,
        boolean canStart,
        GameMode gameMode,
        String reason
) {

    public static Readiness of(RoomSession room) {
        List<PlayerSession> connected = room.getConnectedPlayers();
        int connectedCount = connected.size();
        int readyCount = (int) connected.stream().filter(PlayerSession::isReady).count();
        int total = room.playerCount();
        boolean allReady = connectedCount >= 2 && readyCount == connectedCount;
        boolean teamsFormed = room.getTeams().isFormed();
        GameMode mode = GameMode.forPlayerCount(total);
        boolean teamsOk = !mode.requiresTeams() || teamsFormed;

        String reason;
        if (connectedCount < 2) {
            reason = "Need at least 2 connected players";
        } else if (!allReady) {
            reason = readyCount + "/" + connectedCount + " players ready";
        } else if (!teamsOk) {
            reason = "Teams must be formed for 4-player games";
        } else {
            reason = "Ready to start!";
        }
        return new Readiness(total, connectedCount, readyCount, allReady, teamsFormed, allReady && teamsOk, mode, reason);
    }
}
