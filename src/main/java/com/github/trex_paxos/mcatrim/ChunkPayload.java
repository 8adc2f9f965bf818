package com.github.trex_paxos.mcatrim;

import lombok.val;

/// A chunk record from a region container. The body is inflated once on load so that predicates
/// can scan its field stream.
final class ChunkPayload implements SectorPayload, ChunkFields {

    static final String INHABITED_TIME = "InhabitedTime";
    static final String X_POS = "xPos";
    static final String Y_POS = "yPos";
    static final String Z_POS = "zPos";

    private final byte[] compressedBody;
    private final byte[] fieldStream;

    private ChunkPayload(byte[] compressedBody, byte[] fieldStream) {
        this.compressedBody = compressedBody;
        this.fieldStream = fieldStream;
    }

    static ChunkPayload decode(byte[] slice) throws RegionFormatException {
        val body = PayloadCodec.decode(slice);
        return new ChunkPayload(body, PayloadCodec.inflate(body));
    }

    @Override
    public byte[] compressedBody() {
        return compressedBody;
    }

    byte[] fieldStream() {
        return fieldStream;
    }

    @Override
    public long inhabitedTime() throws RegionFormatException {
        return FieldScanner.readUnsignedLong(fieldStream, INHABITED_TIME);
    }

    @Override
    public int xPos() throws RegionFormatException {
        return FieldScanner.readInt(fieldStream, X_POS);
    }

    @Override
    public int yPos() throws RegionFormatException {
        return FieldScanner.readInt(fieldStream, Y_POS);
    }

    @Override
    public int zPos() throws RegionFormatException {
        return FieldScanner.readInt(fieldStream, Z_POS);
    }
}
