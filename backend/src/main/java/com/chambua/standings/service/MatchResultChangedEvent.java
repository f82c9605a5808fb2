package com.chambua.standings.service;

/**
 * Published by whatever writes match data when a result of the given league season was created, changed or
 * removed.
 */
public record MatchResultChangedEvent(Long leagueId, Long seasonId, Long matchId, String reason) {
}
