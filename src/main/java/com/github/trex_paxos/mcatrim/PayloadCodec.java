package com.github.trex_paxos.mcatrim;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

/// Sector payload framing: a 4 byte big-endian length that counts the scheme byte plus the body,
/// a 1 byte compression scheme, the compressed body, then zero padding up to the next sector.
final class PayloadCodec {

    private final static Logger logger = Logger.getLogger(PayloadCodec.class.getName());

    static final int SECTOR_BYTES = 4096;

    // u32 length + u8 scheme
    static final int HEADER_LENGTH = Integer.BYTES + 1;

    static final int ZLIB = 2;

    // tag type byte + u16 name length of the root compound
    static final int ROOT_FRAME_LENGTH = 3;

    private static final byte[] NO_BYTES = new byte[0];

    private PayloadCodec() {
    }

    /// Returns the compressed body framed in the sector slice.
    static byte[] decode(byte[] slice) throws RegionFormatException {
        if (slice.length < HEADER_LENGTH) {
            throw new RegionFormatException(String.format("payload slice of %d bytes is shorter than its %d byte header",
                    slice.length, HEADER_LENGTH));
        }
        ByteBuffer buffer = ByteBuffer.wrap(slice);
        long length = buffer.getInt() & 0xFFFFFFFFL;
        int scheme = buffer.get() & 0xFF;
        if (scheme != ZLIB) {
            throw new RegionFormatException(String.format("unsupported compression scheme %d", scheme));
        }
        if (length < 1) {
            throw new RegionFormatException("payload length does not cover the compression scheme byte");
        }
        long bodyLength = length - 1;
        if (bodyLength > slice.length - HEADER_LENGTH) {
            throw new RegionFormatException(String.format("payload declares %d body bytes but its sectors hold %d",
                    bodyLength, slice.length - HEADER_LENGTH));
        }
        logger.log(Level.FINEST, () -> String.format("<p len:%d scheme:%d slice:%d", length, scheme, slice.length));
        return Arrays.copyOfRange(slice, HEADER_LENGTH, HEADER_LENGTH + (int) bodyLength);
    }

    /// Frames a compressed body and pads it to whole sectors. A `null` body is an empty slot and
    /// encodes to zero bytes.
    static byte[] encode(byte[] body) {
        if (body == null) {
            return NO_BYTES;
        }
        int framed = HEADER_LENGTH + body.length;
        int padded = paddedLength(framed);
        ByteBuffer buffer = ByteBuffer.allocate(padded);
        buffer.putInt(body.length + 1);
        buffer.put((byte) ZLIB);
        buffer.put(body);
        // the remainder of a fresh heap buffer is already zero
        return buffer.array();
    }

    static int paddedLength(int length) {
        return ((length + SECTOR_BYTES - 1) / SECTOR_BYTES) * SECTOR_BYTES;
    }

    /// Inflates a zlib body and strips the root compound frame to expose its field stream.
    static byte[] inflate(byte[] body) throws RegionFormatException {
        final byte[] decompressed;
        try (InflaterInputStream in = new InflaterInputStream(new ByteArrayInputStream(body))) {
            decompressed = in.readAllBytes();
        } catch (ZipException e) {
            throw new RegionFormatException(RegionFormatException.NO_SLOT, "corrupt zlib stream: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new RegionFormatException(RegionFormatException.NO_SLOT, "could not inflate payload: " + e.getMessage(), e);
        }
        if (decompressed.length < ROOT_FRAME_LENGTH) {
            throw new RegionFormatException(String.format("decompressed payload of %d bytes has no root frame", decompressed.length));
        }
        return Arrays.copyOfRange(decompressed, ROOT_FRAME_LENGTH, decompressed.length);
    }
}
