package com.tony.matchPredictor.model;

public enum MatchOutcome {
    H, D, A;

    public static MatchOutcome fromScore(int homeGoals, int awayGoals) {
        if (homeGoals > awayGoals) return H;
        if (homeGoals == awayGoals) return D;
        return A;
    }
}
