package com.chambua.standings.dto;

import java.util.List;

/** Snapshot metadata plus the captured entries. */
public class SnapshotDetailDTO {
    private final SnapshotSummaryDTO snapshot;
    private final List<LeagueTableEntryDTO> entries;

    public SnapshotDetailDTO(SnapshotSummaryDTO snapshot, List<LeagueTableEntryDTO> entries) {
        this.snapshot = snapshot;
        this.entries = List.copyOf(entries);
    }

    public SnapshotSummaryDTO getSnapshot() { return snapshot; }
    public List<LeagueTableEntryDTO> getEntries() { return entries; }
}
