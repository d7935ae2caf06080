package com.example.cardlobby.model;

/** Team slot of a player; persisted and sent on the wire as 1 or 2. */
public enum TeamAssignment {
    TEAM_1(1),
    TEAM_2(2);

    private final int number;

    TeamAssignment(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }

    public static TeamAssignment fromNumber(Integer n) {
        if (n == null) return null;
        return switch (n) {
            case 1 -> TEAM_1;
            case 2 -> TEAM_2;
            default -> throw new IllegalArgumentException("Unknown team number: " + n);
        };
    }

    public static Integer toNumber(TeamAssignment t) {
        return t == null ? null : t.number;
    }
}
