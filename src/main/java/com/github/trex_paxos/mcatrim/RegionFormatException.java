package com.github.trex_paxos.mcatrim;

import lombok.val;

import java.io.IOException;

/// A container or one of its records does not have the expected binary layout. Fatal for the
/// container being processed and for nothing else.
public class RegionFormatException extends IOException {

    public static final int NO_SLOT = -1;

    private final int slot;

    public RegionFormatException(String message) {
        this(NO_SLOT, message, null);
    }

    public RegionFormatException(int slot, String message) {
        this(slot, message, null);
    }

    public RegionFormatException(int slot, String message, Throwable cause) {
        super(slot == NO_SLOT ? message : String.format("slot %d: %s", slot, message), cause);
        this.slot = slot;
    }

    /// The slot index the error belongs to, or [#NO_SLOT].
    public int getSlot() {
        return slot;
    }

    RegionFormatException atSlot(int index) {
        if (slot != NO_SLOT) return this;
        val wrapped = new RegionFormatException(index, getMessage(), getCause());
        wrapped.setStackTrace(getStackTrace());
        return wrapped;
    }
}
