package com.github.trex_paxos.mcatrim;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// An entities or poi container. Same tables and compaction as a region but the records are
/// opaque and only populated slots are held, so the slot list is sparse.
public final class EntitiesFile extends SlotFile<EntityPayload> {

    private final static Logger logger = Logger.getLogger(EntitiesFile.class.getName());

    private EntitiesFile(List<Slot<EntityPayload>> slots) {
        super(slots);
    }

    public static EntitiesFile load(Path path) throws IOException {
        return fromBytes(readAll(path));
    }

    public static EntitiesFile fromBytes(byte[] data) throws RegionFormatException {
        return new EntitiesFile(readSlots(data, EntityPayload::decode, false));
    }

    /// Removes the record at `index`. Returns false when there was none.
    public boolean removeSlot(int index) {
        for (Iterator<Slot<EntityPayload>> it = slots.iterator(); it.hasNext(); ) {
            if (it.next().getIndex() == index) {
                it.remove();
                dirty = true;
                logger.log(Level.FINEST, () -> String.format("removed slot %d", index));
                return true;
            }
        }
        return false;
    }

    /// Populated indices in file table order.
    public List<Integer> indices() {
        return slots.stream().map(Slot::getIndex).collect(Collectors.toList());
    }
}
