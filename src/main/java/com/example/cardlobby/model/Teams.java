package com.example.cardlobby.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Two-team partition of a room's players (userIds). */
public record Teams(List<String> team1, List<String> team2) {

    public static final Teams EMPTY = new Teams(List.of(), List.of());

    public Teams {
        team1 = (team1 == null) ? List.of() : List.copyOf(team1);
        team2 = (team2 == null) ? List.of() : List.copyOf(team2);
    }

    public boolean isFormed() {
        return !team1.isEmpty() && !team2.isEmpty();
    }

    public TeamAssignment assignmentOf(String userId) {
        if (team1.contains(userId)) return TeamAssignment.TEAM_1;
        if (team2.contains(userId)) return TeamAssignment.TEAM_2;
        return null;
    }

    public List<String> allMembers() {
        List<String> out = new ArrayList<>(team1);
        out.addAll(team2);
        return out;
    }

    /**
     * True when the two teams cover exactly the given players, each once,
     * with sizes ceil(n/2) and floor(n/2).
     */
    public boolean partitions(Set<String> players) {
        List<String> all = allMembers();
        Set<String> unique = new HashSet<>(all);
        if (unique.size() != all.size()) return false;
        if (!unique.equals(players)) return false;
        int n = players.size();
        int big = Math.max(team1.size(), team2.size());
        int small = Math.min(team1.size(), team2.size());
        return big == (n + 1) / 2 && small == n / 2;
    }
}
