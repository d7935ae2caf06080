package com.example.cardlobby.model;

/** 2-player games never need teams; 4-player games are played in two teams of two. */
public enum GameMode {
    TWO_PLAYER("2-player"),
    FOUR_PLAYER("4-player");

    private final String label;

    GameMode(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean requiresTeams() {
        return this == FOUR_PLAYER;
    }

    public static GameMode forPlayerCount(int players) {
        return players >= 4 ? FOUR_PLAYER : TWO_PLAYER;
    }
}
