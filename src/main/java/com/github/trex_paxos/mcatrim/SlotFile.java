package com.github.trex_paxos.mcatrim;

import lombok.val;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// A sector-allocated container of up to 1024 compressed records addressed through a location
/// table, with a companion timestamp table. Instances live for one load, trim, save cycle.
public abstract class SlotFile<P extends SectorPayload> {

    private final static Logger logger = Logger.getLogger(SlotFile.class.getName());

    /// What [#saveTo(Path)] did with the target path.
    public enum SaveOutcome {
        WRITTEN,
        /// Nothing survived so no container was written and any existing one was deleted.
        REMOVED
    }

    @FunctionalInterface
    interface PayloadDecoder<P> {
        P decode(byte[] slice) throws RegionFormatException;
    }

    final List<Slot<P>> slots;

    boolean dirty;

    SlotFile(List<Slot<P>> slots) {
        this.slots = slots;
    }

    /// Parses the two tables and decodes every populated slot. With `dense` an empty slot is kept
    /// for each unused index, otherwise only populated indices are kept.
    static <P extends SectorPayload> List<Slot<P>> readSlots(byte[] data, PayloadDecoder<P> decoder, boolean dense)
            throws RegionFormatException {
        if (data.length < Compactor.HEADER_LENGTH) {
            throw new RegionFormatException(String.format("container of %d bytes is shorter than its %d byte header",
                    data.length, Compactor.HEADER_LENGTH));
        }
        val locations = FixedWidthTable.decode(SlotLocation.CODEC, data, 0);
        val timestamps = FixedWidthTable.decode(Timestamp.CODEC, data, Compactor.LOCATION_TABLE_LENGTH);

        final List<Slot<P>> slots = new ArrayList<>(dense ? FixedWidthTable.ENTRIES : 64);
        for (int i = 0; i < FixedWidthTable.ENTRIES; i++) {
            val location = locations.get(i);
            val timestamp = timestamps.get(i);
            if (location.size() > 0) {
                if (location.offset() < Compactor.FIRST_DATA_SECTOR) {
                    throw new RegionFormatException(i, String.format("payload at sector %d overlaps the header tables",
                            location.offset()));
                }
                long start = (long) location.offset() * PayloadCodec.SECTOR_BYTES;
                long end = start + (long) location.size() * PayloadCodec.SECTOR_BYTES;
                if (end > data.length) {
                    throw new RegionFormatException(i, String.format("payload %s ends at byte %d beyond the %d byte file",
                            location, end, data.length));
                }
                byte[] slice = new byte[(int) (end - start)];
                System.arraycopy(data, (int) start, slice, 0, slice.length);
                final P payload;
                try {
                    payload = decoder.decode(slice);
                } catch (RegionFormatException e) {
                    throw e.atSlot(i);
                }
                slots.add(new Slot<>(i, location, timestamp, payload));
            } else if (dense) {
                slots.add(new Slot<>(i, location, timestamp, null));
            }
        }
        return slots;
    }

    static byte[] readAll(Path path) throws IOException {
        logger.log(Level.FINE, () -> String.format("reading %s", path));
        return Files.readAllBytes(path);
    }

    public List<Slot<P>> getSlots() {
        return Collections.unmodifiableList(slots);
    }

    /// True once any payload has been dropped since load.
    public boolean isDirty() {
        return dirty;
    }

    public int populatedCount() {
        int count = 0;
        for (Slot<P> slot : slots) {
            if (!slot.isEmpty()) count++;
        }
        return count;
    }

    /// Compacts the container. See [Compactor#compact(List)].
    public byte[] toBytes() throws RegionFormatException {
        return Compactor.compact(slots);
    }

    /// Compacts and writes the container to `target`. When no payload survives nothing is written
    /// and an existing file at `target` is deleted.
    public SaveOutcome saveTo(Path target) throws IOException {
        return write(toBytes(), target);
    }

    /// Writes already compacted bytes. The bytes go to a sibling temporary file first so `target`
    /// is never left half written.
    static SaveOutcome write(byte[] data, Path target) throws IOException {
        if (data.length <= Compactor.HEADER_LENGTH) {
            val existed = Files.deleteIfExists(target);
            logger.log(Level.FINE, () -> String.format("no chunks left for %s, deleted existing:%s", target, existed));
            return SaveOutcome.REMOVED;
        }
        val tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.write(tmp, data);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.log(Level.FINE, () -> String.format("wrote %d bytes to %s", data.length, target));
        return SaveOutcome.WRITTEN;
    }

    public void logAll(Level level) {
        logger.log(level, () -> String.format("%s slots=%d populated=%d dirty=%s",
                getClass().getSimpleName(), slots.size(), populatedCount(), dirty));
        for (Slot<P> slot : slots) {
            if (slot.isEmpty()) continue;
            logger.log(level, () -> String.format("%d location=%s timestamp=%d body=%d",
                    slot.getIndex(), slot.getLocation(), slot.getTimestamp().value(),
                    slot.getPayload().compressedBody().length));
        }
    }
}
