package com.github.trex_paxos.mcatrim;

import lombok.val;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Turns a container's slots back into bytes. Payloads are reflowed contiguously from the first
/// sector after the two tables, in the order of their current offsets, so a container that was
/// already packed this way comes out byte-identical.
final class Compactor {

    private final static Logger logger = Logger.getLogger(Compactor.class.getName());

    static final int LOCATION_TABLE_LENGTH = FixedWidthTable.byteLength(SlotLocation.CODEC);
    static final int TIMESTAMP_TABLE_LENGTH = FixedWidthTable.byteLength(Timestamp.CODEC);
    static final int HEADER_LENGTH = LOCATION_TABLE_LENGTH + TIMESTAMP_TABLE_LENGTH;

    // sectors 0 and 1 hold the two tables
    static final int FIRST_DATA_SECTOR = HEADER_LENGTH / PayloadCodec.SECTOR_BYTES;

    private Compactor() {
    }

    /// Reassigns every slot's location (and clears the timestamp of empty slots) then returns
    /// `location table || timestamp table || payload sectors`. The slots may be a sparse subset of
    /// the 1024 indices; indices with no slot are written as zero entries.
    static <P extends SectorPayload> byte[] compact(List<Slot<P>> slots) throws RegionFormatException {
        // List.sort is stable so empty slots sharing offset 0 keep their relative order
        List<Slot<P>> byOffset = new ArrayList<>(slots);
        byOffset.sort(Comparator.comparingInt(s -> s.getLocation().offset()));

        int cursor = FIRST_DATA_SECTOR;
        val sectors = new ByteArrayOutputStream();
        for (Slot<P> slot : byOffset) {
            byte[] encoded = slot.isEmpty() ? PayloadCodec.encode(null) : slot.getPayload().encode();
            if (encoded.length % PayloadCodec.SECTOR_BYTES != 0) {
                throw new IllegalStateException(String.format("slot %d encoded to %d bytes which is not sector aligned",
                        slot.getIndex(), encoded.length));
            }
            int size = encoded.length / PayloadCodec.SECTOR_BYTES;
            if (size == 0) {
                slot.relocate(SlotLocation.UNUSED, Timestamp.ZERO);
                continue;
            }
            if (size > SlotLocation.MAX_SIZE) {
                throw new RegionFormatException(slot.getIndex(),
                        String.format("payload needs %d sectors but a slot holds at most %d", size, SlotLocation.MAX_SIZE));
            }
            final int offset = cursor;
            logger.log(Level.FINEST, () -> String.format(">s idx:%d from:%s to:%d+%d",
                    slot.getIndex(), slot.getLocation(), offset, size));
            slot.relocate(new SlotLocation(offset, size), slot.getTimestamp());
            cursor += size;
            sectors.write(encoded, 0, encoded.length);
        }

        final List<Slot<P>> byIndex = new ArrayList<>(FixedWidthTable.ENTRIES);
        for (int i = 0; i < FixedWidthTable.ENTRIES; i++) {
            byIndex.add(null);
        }
        for (Slot<P> slot : slots) {
            if (byIndex.set(slot.getIndex(), slot) != null) {
                throw new IllegalStateException("two slots share index " + slot.getIndex());
            }
        }

        byte[] locations = FixedWidthTable.encode(SlotLocation.CODEC,
                i -> byIndex.get(i) == null ? null : byIndex.get(i).getLocation());
        byte[] timestamps = FixedWidthTable.encode(Timestamp.CODEC,
                i -> byIndex.get(i) == null ? null : byIndex.get(i).getTimestamp());

        val out = new ByteArrayOutputStream(HEADER_LENGTH + sectors.size());
        out.write(locations, 0, locations.length);
        out.write(timestamps, 0, timestamps.length);
        out.writeBytes(sectors.toByteArray());
        final int used = cursor - FIRST_DATA_SECTOR;
        logger.log(Level.FINE, () -> String.format("compacted %d slots into %d sectors", slots.size(), used));
        return out.toByteArray();
    }
}
