package com.github.trex_paxos.mcatrim;

import lombok.SneakyThrows;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.zip.DeflaterOutputStream;

/// Builds chunk records and containers byte by byte, independently of the production codecs, so
/// tests can compare compaction output against a layout written by hand.
final class RegionFixtures {

    static final int SECTOR = 4096;
    static final int HEADER = 2 * SECTOR;

    static final byte TAG_END = 0;
    static final byte TAG_BYTE = 1;
    static final byte TAG_INT = 3;
    static final byte TAG_LONG = 4;
    static final byte TAG_FLOAT = 5;
    static final byte TAG_DOUBLE = 6;
    static final byte TAG_BYTE_ARRAY = 7;
    static final byte TAG_STRING = 8;
    static final byte TAG_COMPOUND = 10;

    private RegionFixtures() {
    }

    /// A chunk at (x, z) with some realistic neighbouring fields and `noiseLength` random bytes
    /// to make the compressed body span several sectors.
    @SneakyThrows
    static byte[] chunkNbt(int x, int z, long inhabitedTime, int noiseLength, long seed) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        openRoot(out);
        intTag(out, "DataVersion", 3465);
        intTag(out, "xPos", x);
        intTag(out, "yPos", -4);
        intTag(out, "zPos", z);
        stringTag(out, "Status", "minecraft:full");
        longTag(out, "LastUpdate", 987_654L);
        longTag(out, "InhabitedTime", inhabitedTime);
        if (noiseLength > 0) {
            byte[] noise = new byte[noiseLength];
            new Random(seed).nextBytes(noise);
            out.writeByte(TAG_BYTE_ARRAY);
            name(out, "Noise");
            out.writeInt(noise.length);
            out.write(noise);
        }
        out.writeByte(TAG_END);
        out.flush();
        return bytes.toByteArray();
    }

    /// The chunk at slot `index` of a region, with coordinates derived from the index.
    static byte[] chunkAt(int index, long inhabitedTime) {
        return deflate(chunkNbt(index % 32, index / 32, inhabitedTime, 0, index));
    }

    @SneakyThrows
    static void openRoot(DataOutputStream out) {
        out.writeByte(TAG_COMPOUND);
        out.writeShort(0);
    }

    @SneakyThrows
    static void name(DataOutputStream out, String name) {
        byte[] b = name.getBytes(StandardCharsets.UTF_8);
        out.writeShort(b.length);
        out.write(b);
    }

    @SneakyThrows
    static void intTag(DataOutputStream out, String name, int value) {
        out.writeByte(TAG_INT);
        name(out, name);
        out.writeInt(value);
    }

    @SneakyThrows
    static void longTag(DataOutputStream out, String name, long value) {
        out.writeByte(TAG_LONG);
        name(out, name);
        out.writeLong(value);
    }

    @SneakyThrows
    static void stringTag(DataOutputStream out, String name, String value) {
        out.writeByte(TAG_STRING);
        name(out, name);
        out.writeUTF(value);
    }

    @SneakyThrows
    static byte[] deflate(byte[] raw) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DeflaterOutputStream out = new DeflaterOutputStream(bytes)) {
            out.write(raw);
        }
        return bytes.toByteArray();
    }

    /// `u32 length || scheme || body`, zero padded to whole sectors.
    @SneakyThrows
    static byte[] frame(byte[] body, int scheme) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeInt(body.length + 1);
        out.writeByte(scheme);
        out.write(body);
        while (bytes.size() % SECTOR != 0) {
            out.writeByte(0);
        }
        return bytes.toByteArray();
    }

    static byte[] frame(byte[] body) {
        return frame(body, 2);
    }

    /// Lays payloads out from sector 2 in the order they are added, with optional unused sectors
    /// in front of each.
    static final class ContainerBuilder {

        private record Entry(int index, byte[] framed, long timestamp, int gapSectors) {
        }

        private final List<Entry> entries = new ArrayList<>();

        ContainerBuilder add(int index, byte[] body, long timestamp) {
            return add(index, body, timestamp, 0);
        }

        ContainerBuilder add(int index, byte[] body, long timestamp, int gapSectors) {
            entries.add(new Entry(index, frame(body), timestamp, gapSectors));
            return this;
        }

        ContainerBuilder addFramed(int index, byte[] framed, long timestamp) {
            entries.add(new Entry(index, framed, timestamp, 0));
            return this;
        }

        @SneakyThrows
        byte[] build() {
            byte[] locations = new byte[SECTOR];
            byte[] timestamps = new byte[SECTOR];
            ByteArrayOutputStream sectors = new ByteArrayOutputStream();
            int sector = 2;
            for (Entry e : entries) {
                sectors.write(new byte[e.gapSectors * SECTOR]);
                sector += e.gapSectors;
                int size = e.framed.length / SECTOR;
                putInt(locations, e.index * 4, (sector << 8) | size);
                putInt(timestamps, e.index * 4, (int) e.timestamp);
                sectors.write(e.framed);
                sector += size;
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            out.write(locations);
            out.write(timestamps);
            out.write(sectors.toByteArray());
            return out.toByteArray();
        }
    }

    static void putInt(byte[] target, int at, int value) {
        target[at] = (byte) (value >>> 24);
        target[at + 1] = (byte) (value >>> 16);
        target[at + 2] = (byte) (value >>> 8);
        target[at + 3] = (byte) value;
    }
}
