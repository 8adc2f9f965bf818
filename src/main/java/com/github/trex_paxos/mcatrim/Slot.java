package com.github.trex_paxos.mcatrim;

import lombok.Getter;

/// One addressable position of a container: where its payload lives, when it was last modified
/// and the payload itself. A `null` payload is an empty slot.
@Getter
public final class Slot<P extends SectorPayload> {

    private final int index;
    private SlotLocation location;
    private Timestamp timestamp;
    private P payload;

    Slot(int index, SlotLocation location, Timestamp timestamp, P payload) {
        if (index < 0 || index >= FixedWidthTable.ENTRIES) {
            throw new IllegalArgumentException("slot index out of range: " + index);
        }
        this.index = index;
        this.location = location;
        this.timestamp = timestamp;
        this.payload = payload;
    }

    public boolean isEmpty() {
        return payload == null;
    }

    /// Drops the payload. Returns whether there was one to drop.
    boolean clear() {
        if (payload == null) return false;
        payload = null;
        return true;
    }

    void relocate(SlotLocation location, Timestamp timestamp) {
        this.location = location;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return String.format("Slot[%d @ %s ts:%d %s]", index, location, timestamp.value(), isEmpty() ? "empty" : "used");
    }
}
