package com.github.trex_paxos.mcatrim;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

/// A table of [#ENTRIES] fixed-width entries. The encoded form is always
/// `ENTRIES * codec.width()` bytes regardless of how many entries are populated.
final class FixedWidthTable<T> {

    static final int ENTRIES = 1024;

    private final List<T> entries;

    private FixedWidthTable(List<T> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    static int byteLength(FixedWidthCodec<?> codec) {
        return ENTRIES * codec.width();
    }

    static <T> FixedWidthTable<T> decode(FixedWidthCodec<T> codec, byte[] data, int from) {
        if (from < 0 || data.length - from < byteLength(codec)) {
            throw new IllegalArgumentException(String.format("table needs %d bytes from %d but only %d are available",
                    byteLength(codec), from, data.length - from));
        }
        ByteBuffer buffer = ByteBuffer.wrap(data, from, byteLength(codec));
        List<T> entries = new ArrayList<>(ENTRIES);
        for (int i = 0; i < ENTRIES; i++) {
            entries.add(codec.read(buffer));
        }
        return new FixedWidthTable<>(entries);
    }

    /// Encodes the entry returned for every index in `0..ENTRIES-1`. A `null` entry is written as
    /// [FixedWidthCodec#empty()].
    static <T> byte[] encode(FixedWidthCodec<T> codec, IntFunction<T> entryAt) {
        ByteBuffer buffer = ByteBuffer.allocate(byteLength(codec));
        for (int i = 0; i < ENTRIES; i++) {
            T entry = entryAt.apply(i);
            codec.write(entry == null ? codec.empty() : entry, buffer);
        }
        assert !buffer.hasRemaining();
        return buffer.array();
    }

    T get(int index) {
        return entries.get(index);
    }

    int size() {
        return entries.size();
    }
}
