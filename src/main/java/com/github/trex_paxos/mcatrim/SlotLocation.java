package com.github.trex_paxos.mcatrim;

import java.nio.ByteBuffer;

/// Where a slot's payload lives: a sector offset counted from the start of the file and a
/// sector count. Both zero means the slot is unused.
public record SlotLocation(int offset, int size) {

    public static final SlotLocation UNUSED = new SlotLocation(0, 0);

    // 3 byte offset, 1 byte size
    static final int MAX_OFFSET = 0xFFFFFF;
    static final int MAX_SIZE = 0xFF;

    static final FixedWidthCodec<SlotLocation> CODEC = new FixedWidthCodec<>() {
        @Override
        public int width() {
            return Integer.BYTES;
        }

        @Override
        public void write(SlotLocation value, ByteBuffer out) {
            if (value.offset < 0 || value.offset > MAX_OFFSET) {
                throw new IllegalStateException("sector offset does not fit in 3 bytes: " + value);
            }
            if (value.size < 0 || value.size > MAX_SIZE) {
                throw new IllegalStateException("sector count does not fit in 1 byte: " + value);
            }
            out.putInt((value.offset << 8) | value.size);
        }

        @Override
        public SlotLocation read(ByteBuffer in) {
            int packed = in.getInt();
            return new SlotLocation(packed >>> 8, packed & 0xFF);
        }

        @Override
        public SlotLocation empty() {
            return UNUSED;
        }
    };

    public boolean isUnused() {
        return offset == 0 && size == 0;
    }

    @Override
    public String toString() {
        return offset + "+" + size;
    }
}
