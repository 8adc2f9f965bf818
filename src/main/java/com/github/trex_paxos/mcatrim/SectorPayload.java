package com.github.trex_paxos.mcatrim;

/// A record held in a slot: its compressed body, framed on demand into whole sectors.
public interface SectorPayload {

    /// The compressed body without the 5 byte header or padding.
    byte[] compressedBody();

    /// The header, body and zero padding; always a non-zero multiple of the sector size.
    default byte[] encode() {
        return PayloadCodec.encode(compressedBody());
    }
}
