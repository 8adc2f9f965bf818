package com.github.trex_paxos.mcatrim;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A region container: 1024 chunk slots for a 32x32 grid of chunks, one slot per index whether
/// populated or not.
public final class RegionFile extends SlotFile<ChunkPayload> {

    private final static Logger logger = Logger.getLogger(RegionFile.class.getName());

    private final List<Integer> cleared = new ArrayList<>();

    private RegionFile(List<Slot<ChunkPayload>> slots) {
        super(slots);
        assert slots.size() == FixedWidthTable.ENTRIES;
    }

    public static RegionFile load(Path path) throws IOException {
        return fromBytes(readAll(path));
    }

    public static RegionFile fromBytes(byte[] data) throws RegionFormatException {
        return new RegionFile(readSlots(data, ChunkPayload::decode, true));
    }

    /// Drops the payload of every populated slot the predicate selects. Already empty slots are
    /// never offered to the predicate, so clearing cannot be undone by a later call.
    public void trim(TrimPredicate predicate) throws RegionFormatException {
        for (Slot<ChunkPayload> slot : slots) {
            if (slot.isEmpty()) continue;
            final boolean trim;
            try {
                trim = predicate.shouldTrim(slot.getPayload());
            } catch (RegionFormatException e) {
                throw e.atSlot(slot.getIndex());
            }
            if (trim && slot.clear()) {
                cleared.add(slot.getIndex());
                dirty = true;
                logger.log(Level.FINEST, () -> String.format("trimmed slot %d", slot.getIndex()));
            }
        }
    }

    /// Indices cleared by [#trim(TrimPredicate)] since load, ascending.
    public List<Integer> clearedIndices() {
        List<Integer> sorted = new ArrayList<>(cleared);
        Collections.sort(sorted);
        return sorted;
    }

    /// The scan view of the chunk at `index`, if the slot is populated.
    public Optional<ChunkFields> chunkAt(int index) {
        return Optional.ofNullable(slots.get(index).getPayload());
    }
}
