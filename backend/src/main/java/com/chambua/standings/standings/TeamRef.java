package com.chambua.standings.standings;

/**
 * A table participant: opaque identifier plus the name used for display and the last tie-break.
 */
public record TeamRef(Long id, String name) {

    /** Name used for ordering; falls back to the identifier when the store has no name. */
    public String sortName() {
        return name != null ? name : String.valueOf(id);
    }
}
