package com.github.trex_paxos.mcatrim;

/// Fixed-width tag types of the world-data compound format that the field scan can read.
public enum TagType {
    BYTE(1, 1),
    INT(3, 4),
    LONG(4, 8),
    FLOAT(5, 4),
    DOUBLE(6, 8);

    final byte id;
    final int payloadWidth;

    TagType(int id, int payloadWidth) {
        this.id = (byte) id;
        this.payloadWidth = payloadWidth;
    }

    public int getId() {
        return id;
    }

    public int getPayloadWidth() {
        return payloadWidth;
    }
}
