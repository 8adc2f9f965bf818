package com.github.trex_paxos.mcatrim;

import java.nio.ByteBuffer;

/// Reads and writes one fixed-width table entry. Every entry of a given codec occupies exactly
/// [#width()] bytes, populated or not.
///
/// @param <T> the entry type
interface FixedWidthCodec<T> {

    int width();

    /// Writes exactly [#width()] bytes at the buffer position.
    void write(T value, ByteBuffer out);

    /// Reads exactly [#width()] bytes from the buffer position.
    T read(ByteBuffer in);

    /// The entry written for an index that has nothing in memory.
    T empty();
}
