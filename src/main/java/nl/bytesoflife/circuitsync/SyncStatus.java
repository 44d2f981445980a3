package nl.bytesoflife.circuitsync;

public enum SyncStatus {
    NO_CHANGES,
    CHANGES_APPLIED
}
