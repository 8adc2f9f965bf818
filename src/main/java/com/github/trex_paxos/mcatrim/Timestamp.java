package com.github.trex_paxos.mcatrim;

import java.nio.ByteBuffer;

/// Opaque per-slot modification marker, an unsigned 32 bit value.
public record Timestamp(long value) {

    public static final Timestamp ZERO = new Timestamp(0);

    static final FixedWidthCodec<Timestamp> CODEC = new FixedWidthCodec<>() {
        @Override
        public int width() {
            return Integer.BYTES;
        }

        @Override
        public void write(Timestamp value, ByteBuffer out) {
            out.putInt((int) value.value);
        }

        @Override
        public Timestamp read(ByteBuffer in) {
            return new Timestamp(in.getInt() & 0xFFFFFFFFL);
        }

        @Override
        public Timestamp empty() {
            return ZERO;
        }
    };

    public Timestamp {
        if (value < 0 || value > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("timestamp is not an unsigned 32 bit value: " + value);
        }
    }
}
