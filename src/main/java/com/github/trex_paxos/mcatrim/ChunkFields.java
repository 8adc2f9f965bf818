package com.github.trex_paxos.mcatrim;

/// Read-only view of the scanned fields of one chunk record. Retention predicates only see this.
public interface ChunkFields {

    /// Ticks players have spent in the chunk, read as an unsigned 64 bit value.
    long inhabitedTime() throws RegionFormatException;

    int xPos() throws RegionFormatException;

    int yPos() throws RegionFormatException;

    int zPos() throws RegionFormatException;
}
