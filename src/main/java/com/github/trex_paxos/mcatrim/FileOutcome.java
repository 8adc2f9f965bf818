package com.github.trex_paxos.mcatrim;

/// What the batch did with one region container.
public enum FileOutcome {
    /// Chunks were trimmed and the compacted container was written.
    TRIMMED(true, true),
    /// Every chunk was trimmed so no container was written and any existing output was deleted.
    DELETED(true, true),
    /// Nothing matched; the original was copied to the output directory.
    COPIED(true, false),
    /// Nothing matched and output is input.
    UNCHANGED(true, false),
    /// A write failed after the trim had started reaching disk. Entities and poi containers are
    /// written before the region, so rerunning the batch completes the file.
    PARTIAL(false, true),
    FAILED(false, false),
    /// Not attempted because an earlier file on the same worker failed unexpectedly.
    SKIPPED(false, false);

    private final boolean success;
    private final boolean changed;

    FileOutcome(boolean success, boolean changed) {
        this.success = success;
        this.changed = changed;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isChanged() {
        return changed;
    }
}
