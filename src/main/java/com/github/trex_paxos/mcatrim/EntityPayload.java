package com.github.trex_paxos.mcatrim;

/// An opaque record from an entities or poi container. Only the framing is checked.
final class EntityPayload implements SectorPayload {

    private final byte[] compressedBody;

    private EntityPayload(byte[] compressedBody) {
        this.compressedBody = compressedBody;
    }

    static EntityPayload decode(byte[] slice) throws RegionFormatException {
        return new EntityPayload(PayloadCodec.decode(slice));
    }

    @Override
    public byte[] compressedBody() {
        return compressedBody;
    }
}
