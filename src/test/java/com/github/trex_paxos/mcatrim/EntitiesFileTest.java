package com.github.trex_paxos.mcatrim;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

import static com.github.trex_paxos.mcatrim.RegionFixtures.ContainerBuilder;
import static com.github.trex_paxos.mcatrim.RegionFixtures.HEADER;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

public class EntitiesFileTest extends JulLoggingConfig {

    // entity bodies are never inflated so any bytes will do
    static byte[] opaque(int length, int fill) {
        byte[] body = new byte[length];
        Arrays.fill(body, (byte) fill);
        return body;
    }

    @Test
    public void testOnlyPopulatedSlotsAreHeld() throws Exception {
        byte[] input = new ContainerBuilder()
                .add(40, opaque(10, 1), 7)
                .add(3, opaque(5000, 2), 8)
                .add(900, opaque(1, 3), 9)
                .build();
        EntitiesFile entities = EntitiesFile.fromBytes(input);
        assertThat(entities.indices(), contains(3, 40, 900));
        Assert.assertEquals(3, entities.populatedCount());
        Assert.assertFalse(entities.isDirty());
        Assert.assertArrayEquals(input, entities.toBytes());
    }

    @Test
    public void testRemoveSlotGapFillsTheTables() throws Exception {
        byte[] input = new ContainerBuilder()
                .add(40, opaque(10, 1), 7)
                .add(3, opaque(5000, 2), 8)
                .add(900, opaque(1, 3), 9)
                .build();
        EntitiesFile entities = EntitiesFile.fromBytes(input);

        Assert.assertTrue(entities.removeSlot(3));
        Assert.assertFalse(entities.removeSlot(3));
        Assert.assertFalse(entities.removeSlot(41));
        Assert.assertTrue(entities.isDirty());
        assertThat(entities.indices(), contains(40, 900));

        byte[] expected = new ContainerBuilder()
                .add(40, opaque(10, 1), 7)
                .add(900, opaque(1, 3), 9)
                .build();
        Assert.assertArrayEquals(expected, entities.toBytes());
    }

    @Test
    public void testRemovingEverythingLeavesOnlyTables() throws Exception {
        EntitiesFile entities = EntitiesFile.fromBytes(new ContainerBuilder().add(0, opaque(3, 9), 1).build());
        Assert.assertTrue(entities.removeSlot(0));
        Assert.assertArrayEquals(new byte[HEADER], entities.toBytes());
    }

    @Test
    public void testBodiesAreNotInflated() throws Exception {
        // not a zlib stream, which a region would reject
        EntitiesFile entities = EntitiesFile.fromBytes(new ContainerBuilder().add(12, opaque(64, 0x7f), 1).build());
        Assert.assertEquals(64, entities.getSlots().get(0).getPayload().compressedBody().length);
    }

    @Test
    public void testSchemeIsStillChecked() {
        byte[] input = new ContainerBuilder()
                .addFramed(12, RegionFixtures.frame(opaque(4, 1), 1), 1)
                .build();
        try {
            EntitiesFile.fromBytes(input);
            Assert.fail("accepted a gzip record");
        } catch (RegionFormatException e) {
            Assert.assertEquals(12, e.getSlot());
        }
    }
}
