package com.github.trex_paxos.mcatrim;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.junit.Assert;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static com.github.trex_paxos.mcatrim.RegionFixtures.ContainerBuilder;
import static com.github.trex_paxos.mcatrim.RegionFixtures.HEADER;
import static com.github.trex_paxos.mcatrim.RegionFixtures.SECTOR;
import static com.github.trex_paxos.mcatrim.RegionFixtures.chunkNbt;
import static com.github.trex_paxos.mcatrim.RegionFixtures.deflate;

/// Randomly laid out regions (shuffled offsets, gaps between payloads, payloads of one to three
/// sectors) trimmed with every criterion.
public class CompactorPropertiesTest extends JulLoggingConfig {

    @Property(tries = 50)
    void trimmedOutputIsAFixedPointOfRepacking(@ForAll("indices") Set<Integer> indices,
                                               @ForAll long seed,
                                               @ForAll("criteria") TrimCriteria criteria) throws Exception {
        byte[] input = randomRegion(indices, seed);
        RegionFile region = RegionFile.fromBytes(input);
        region.trim(criteria);
        byte[] once = region.toBytes();

        RegionFile reloaded = RegionFile.fromBytes(once);
        reloaded.trim(TrimPredicate.NONE);
        Assert.assertTrue("reload of packed output is dirty", !reloaded.isDirty());
        Assert.assertTrue("repacking changed the bytes", Arrays.equals(once, reloaded.toBytes()));
    }

    @Property(tries = 50)
    void payloadsAreSectorAlignedAndContiguous(@ForAll("indices") Set<Integer> indices,
                                               @ForAll long seed,
                                               @ForAll("criteria") TrimCriteria criteria) throws Exception {
        RegionFile region = RegionFile.fromBytes(randomRegion(indices, seed));
        region.trim(criteria);
        byte[] out = region.toBytes();
        Assert.assertTrue("length not sector aligned: " + out.length, out.length % SECTOR == 0);
        Assert.assertTrue("missing tables", out.length >= HEADER);

        List<int[]> used = new ArrayList<>();
        ByteBuffer table = ByteBuffer.wrap(out, 0, HEADER);
        for (int i = 0; i < 1024; i++) {
            int entry = table.getInt(i * 4);
            int timestamp = table.getInt(4096 + i * 4);
            int offset = entry >>> 8;
            int size = entry & 0xFF;
            boolean populated = !region.getSlots().get(i).isEmpty();
            if (populated) {
                Assert.assertTrue("slot " + i + " has no location", offset >= 2 && size >= 1);
                used.add(new int[]{offset, size});
            } else {
                Assert.assertTrue("empty slot " + i + " has a non-zero table entry", entry == 0 && timestamp == 0);
            }
        }
        used.sort((a, b) -> Integer.compare(a[0], b[0]));
        int cursor = 2;
        for (int[] u : used) {
            Assert.assertTrue("gap or overlap at sector " + cursor, u[0] == cursor);
            cursor += u[1];
        }
        Assert.assertTrue("trailing bytes after last payload", cursor * SECTOR == out.length);
    }

    @Property(tries = 50)
    void clearingIsMonotonicAndDrivesTheDirtyFlag(@ForAll("indices") Set<Integer> indices,
                                                  @ForAll long seed,
                                                  @ForAll("criteria") TrimCriteria first,
                                                  @ForAll("criteria") TrimCriteria second) throws Exception {
        RegionFile region = RegionFile.fromBytes(randomRegion(indices, seed));
        region.trim(first);
        List<Integer> afterFirst = region.clearedIndices();
        Assert.assertTrue("dirty flag disagrees with cleared slots", region.isDirty() == !afterFirst.isEmpty());

        region.trim(second);
        List<Integer> afterSecond = region.clearedIndices();
        Assert.assertTrue("a cleared slot came back", afterSecond.containsAll(afterFirst));
        for (int index : afterSecond) {
            Assert.assertTrue("cleared slot " + index + " still has a payload", region.getSlots().get(index).isEmpty());
        }
        Assert.assertTrue("dirty flag disagrees with cleared slots", region.isDirty() == !afterSecond.isEmpty());
        Assert.assertTrue("slots lost or invented", region.populatedCount() + afterSecond.size() == indices.size());
    }

    @Provide
    Arbitrary<Set<Integer>> indices() {
        return Arbitraries.integers().between(0, 1023).set().ofMinSize(0).ofMaxSize(40);
    }

    @Provide
    Arbitrary<TrimCriteria> criteria() {
        return Arbitraries.of(TrimCriteria.class);
    }

    static byte[] randomRegion(Set<Integer> indices, long seed) {
        Random random = new Random(seed);
        List<Integer> order = new ArrayList<>(indices);
        Collections.sort(order);
        Collections.shuffle(order, random);
        ContainerBuilder builder = new ContainerBuilder();
        for (int index : order) {
            long inhabited = random.nextInt(15_000);
            int noise = random.nextInt(4) == 0 ? random.nextInt(10_000) : 0;
            byte[] body = deflate(chunkNbt(index % 32, index / 32, inhabited, noise, random.nextLong()));
            builder.add(index, body, random.nextInt() & 0x7fffffff, random.nextInt(3));
        }
        return builder.build();
    }
}
