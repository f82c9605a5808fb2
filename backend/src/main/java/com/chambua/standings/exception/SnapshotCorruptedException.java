package com.chambua.standings.exception;

/**
 * Stored snapshot content no longer matches its checksum or cannot be read back.
 */
public class SnapshotCorruptedException extends StandingsException {

    public SnapshotCorruptedException(Long snapshotId, String reason) {
        super("Snapshot " + snapshotId + " is corrupted: " + reason);
    }

    public SnapshotCorruptedException(Long snapshotId, Throwable cause) {
        super("Snapshot " + snapshotId + " is corrupted: " + cause.getMessage(), cause);
    }

    @Override
    public ErrorCategory getCategory() { return ErrorCategory.CONTACT_OPERATOR; }

    @Override
    public String getCode() { return "SNAPSHOT_CORRUPTED"; }
}
