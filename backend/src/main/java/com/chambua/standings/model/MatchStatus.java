package com.chambua.standings.model;

public enum MatchStatus {
    SCHEDULED,
    IN_PROGRESS,
    FINISHED,
    CANCELLED,
    POSTPONED
}
