package com.github.trex_paxos.mcatrim;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Reads one named field from a decompressed field stream without parsing it. The scan looks for
/// the byte sequence `type id || u16 name length || name` and reads the fixed-width big-endian
/// value that follows the first match.
///
/// This is only correct when the name is unique within the stream. A field of the same type and
/// name nested inside an earlier sub-compound is returned instead of the top-level one.
public final class FieldScanner {

    private final static Logger logger = Logger.getLogger(FieldScanner.class.getName());

    private FieldScanner() {
    }

    public static byte readByte(byte[] stream, String name) throws RegionFormatException {
        return valueAt(stream, name, TagType.BYTE).get();
    }

    public static int readInt(byte[] stream, String name) throws RegionFormatException {
        return valueAt(stream, name, TagType.INT).getInt();
    }

    /// The 8 value bytes as an unsigned 64 bit number. Values above `Long.MAX_VALUE` come back
    /// negative; compare them with [Long#compareUnsigned(long, long)].
    public static long readUnsignedLong(byte[] stream, String name) throws RegionFormatException {
        return valueAt(stream, name, TagType.LONG).getLong();
    }

    public static float readFloat(byte[] stream, String name) throws RegionFormatException {
        return valueAt(stream, name, TagType.FLOAT).getFloat();
    }

    public static double readDouble(byte[] stream, String name) throws RegionFormatException {
        return valueAt(stream, name, TagType.DOUBLE).getDouble();
    }

    static byte[] pattern(TagType type, String name) {
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        if (nameBytes.length > 0xFFFF) {
            throw new IllegalArgumentException("field name longer than 65535 bytes");
        }
        ByteBuffer buffer = ByteBuffer.allocate(1 + Short.BYTES + nameBytes.length);
        buffer.put(type.id);
        buffer.putShort((short) nameBytes.length);
        buffer.put(nameBytes);
        return buffer.array();
    }

    /// Index of the first occurrence of `pattern` in `stream`, or -1.
    static int indexOf(byte[] stream, byte[] pattern) {
        final int last = stream.length - pattern.length;
        outer:
        for (int i = 0; i <= last; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (stream[i + j] != pattern[j]) continue outer;
            }
            return i;
        }
        return -1;
    }

    private static ByteBuffer valueAt(byte[] stream, String name, TagType type) throws RegionFormatException {
        byte[] pattern = pattern(type, name);
        int start = indexOf(stream, pattern);
        if (start < 0) {
            throw new RegionFormatException(String.format("field '%s' not found", name));
        }
        int valueStart = start + pattern.length;
        if (valueStart + type.payloadWidth > stream.length) {
            throw new RegionFormatException(String.format("field '%s' at %d is cut short by the end of the stream", name, start));
        }
        logger.log(Level.FINEST, () -> String.format("<f name:%s type:%s at:%d", name, type, start));
        return ByteBuffer.wrap(stream, valueStart, type.payloadWidth);
    }
}
