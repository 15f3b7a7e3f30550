package io.brickmux.storage;

import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.apache.curator.test.TestingServer;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

import io.brickmux.curator.CuratorPersister;
import io.brickmux.storage.StorageError.Reason;
import io.brickmux.testutils.CuratorTestUtils;

/**
 * Tests for {@link MemPersister}. Each check also runs against a {@link CuratorPersister} on an in-process
 * ZooKeeper, so that both backends are held to the same behavior.
 */
public class MemPersisterTest {
    private static final String BRICK_1 = "Volumes/v1/peer-1:__bricks__b1";
    private static final String BRICK_2 = "Volumes/v1/peer-1:__bricks__b2";

    private static final byte[] OPTIONS = "{\"nfs.disable\":\"on\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] DEFINITION = "{\"peer\":\"peer-1\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] ONLINE = "{\"state\":\"ONLINE\"}".getBytes(StandardCharsets.UTF_8);
    private static final byte[] OFFLINE = "{\"state\":\"OFFLINE\"}".getBytes(StandardCharsets.UTF_8);

    private static TestingServer testZk;

    private interface Check {
        void run(Persister persister) throws Exception;
    }

    @BeforeClass
    public static void beforeAll() throws Exception {
        testZk = new TestingServer();
    }

    @AfterClass
    public static void afterAll() throws Exception {
        testZk.close();
    }

    private static void checkBoth(Check check) throws Exception {
        CuratorTestUtils.clear(testZk);
        Persister curatorPersister = CuratorPersister.newBuilder("test-cluster", testZk.getConnectString()).build();
        try {
            check.run(curatorPersister);
        } finally {
            curatorPersister.close();
        }
        check.run(MemPersister.newBuilder().setExitOnDeadlock(false).build());
    }

    private static void storeVolume(Persister persister) throws Exception {
        Map<String, byte[]> values = new TreeMap<>();
        values.put("Volumes/v1/Options", OPTIONS);
        values.put(BRICK_1 + "/Brick", DEFINITION);
        values.put(BRICK_2 + "/Brick", DEFINITION);
        values.put("Volumes/v2/Options", OPTIONS);
        persister.setMany(values);
    }

    private static void assertNotFound(Check check, Persister persister) throws Exception {
        try {
            check.run(persister);
            fail("expected exception");
        } catch (PersisterException e) {
            assertEquals(Reason.NOT_FOUND, e.getReason());
        }
    }

    @Test
    public void testMissingVolume() throws Exception {
        checkBoth(persister -> {
            assertNotFound(p -> p.get("Volumes/v1/Options"), persister);
            assertNotFound(p -> p.getChildren("Volumes"), persister);
            assertNotFound(p -> p.recursiveDelete("Volumes/v1"), persister);
            assertNull(persister.get(""));
        });
    }

    @Test
    public void testVolumeLayout() throws Exception {
        checkBoth(persister -> {
            storeVolume(persister);

            assertEquals(new TreeSet<>(Arrays.asList("v1", "v2")), persister.getChildren("Volumes"));
            assertEquals(new TreeSet<>(Arrays.asList("Options", "peer-1:__bricks__b1", "peer-1:__bricks__b2")),
                    persister.getChildren("/Volumes/v1/"));
            assertTrue(persister.getChildren(BRICK_1 + "/Brick").isEmpty());
            assertArrayEquals(OPTIONS, persister.get("Volumes/v1/Options"));
            assertArrayEquals(DEFINITION, persister.get("/" + BRICK_1 + "/Brick"));
            // intermediate nodes hold no data:
            assertNull(persister.get("Volumes/v1"));
            assertNull(persister.get(BRICK_1));
        });
    }

    @Test
    public void testSetManyReplacesRecords() throws Exception {
        checkBoth(persister -> {
            storeVolume(persister);
            persister.setMany(Collections.singletonMap(BRICK_1 + "/Runtime", ONLINE));
            persister.setMany(Collections.singletonMap(BRICK_1 + "/Runtime", OFFLINE));
            persister.setMany(Collections.emptyMap());

            assertArrayEquals(OFFLINE, persister.get(BRICK_1 + "/Runtime"));
            assertArrayEquals(DEFINITION, persister.get(BRICK_1 + "/Brick"));
        });
    }

    @Test
    public void testDeleteVolumeKeepsOtherVolumes() throws Exception {
        checkBoth(persister -> {
            storeVolume(persister);
            persister.recursiveDelete("Volumes/v1");

            assertEquals(new TreeSet<>(Arrays.asList("v2")), persister.getChildren("Volumes"));
            assertNotFound(p -> p.get(BRICK_1 + "/Brick"), persister);
            assertNotFound(p -> p.getChildren("Volumes/v1"), persister);

            // the emptied parent stays behind
            persister.recursiveDelete("Volumes/v2");
            assertTrue(persister.getChildren("Volumes").isEmpty());
        });
    }

    @Test
    public void testRuntimeUpdateRequiresBrickDefinition() throws Exception {
        checkBoth(persister -> {
            storeVolume(persister);
            assertTrue(persister.setManyIfPresent(BRICK_1 + "/Brick",
                    Collections.singletonMap(BRICK_1 + "/Runtime", ONLINE)));
            assertArrayEquals(ONLINE, persister.get(BRICK_1 + "/Runtime"));

            assertFalse(persister.setManyIfPresent("Volumes/v1/peer-2:__bricks__b1/Brick",
                    Collections.singletonMap("Volumes/v1/peer-2:__bricks__b1/Runtime", ONLINE)));
            assertEquals(3, persister.getChildren("Volumes/v1").size());

            persister.recursiveDelete("Volumes/v1");
            assertFalse(persister.setManyIfPresent(BRICK_1 + "/Brick",
                    Collections.singletonMap(BRICK_1 + "/Runtime", OFFLINE)));
            assertEquals(new TreeSet<>(Arrays.asList("v2")), persister.getChildren("Volumes"));
        });
    }

    @Test
    public void testRootCannotBeDeleted() throws Exception {
        checkBoth(persister -> {
            storeVolume(persister);
            for (String root : Arrays.asList("", "/")) {
                try {
                    persister.recursiveDelete(root);
                    fail("expected exception");
                } catch (PersisterException e) {
                    assertEquals(Reason.LOGIC_ERROR, e.getReason());
                }
            }
            assertArrayEquals(OPTIONS, persister.get("Volumes/v2/Options"));
        });
    }

    @Test
    public void testStoredDataIsCopied() throws Exception {
        Persister persister = MemPersister.newBuilder().setExitOnDeadlock(false).build();
        byte[] runtime = ONLINE.clone();
        persister.setMany(Collections.singletonMap(BRICK_1 + "/Runtime", runtime));
        runtime[0] = 'x';
        assertArrayEquals(ONLINE, persister.get(BRICK_1 + "/Runtime"));
    }

    @Test
    public void testConcurrentVolumeWriters() throws Exception {
        Persister persister = MemPersister.newBuilder().setExitOnDeadlock(false).build();
        int volumeCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(volumeCount);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < volumeCount; ++i) {
            String volumePath = "Volumes/v" + i;
            futures.add(executor.submit(() -> {
                for (int round = 0; round < 100; ++round) {
                    persister.setMany(Collections.singletonMap(volumePath + "/b1/Brick", DEFINITION));
                    assertTrue(persister.setManyIfPresent(volumePath + "/b1/Brick",
                            Collections.singletonMap(volumePath + "/b1/Runtime", ONLINE)));
                    assertEquals(new TreeSet<>(Arrays.asList("Brick", "Runtime")),
                            persister.getChildren(volumePath + "/b1"));
                    persister.recursiveDelete(volumePath);
                }
                return null;
            }));
        }
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();
        assertTrue(persister.getChildren("Volumes").isEmpty());
    }
}
