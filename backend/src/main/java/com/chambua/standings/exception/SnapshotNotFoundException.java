package com.chambua.standings.exception;

public class SnapshotNotFoundException extends StandingsException {

    public SnapshotNotFoundException(Long snapshotId) {
        super("Snapshot not found: " + snapshotId);
    }

    @Override
    public ErrorCategory getCategory() { return ErrorCategory.CONTACT_OPERATOR; }

    @Override
    public String getCode() { return "SNAPSHOT_NOT_FOUND"; }
}
