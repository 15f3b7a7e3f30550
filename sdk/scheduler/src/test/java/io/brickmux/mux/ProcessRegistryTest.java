package io.brickmux.mux;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.locks.ReentrantLock;

import org.junit.Before;
import org.junit.Test;

import io.brickmux.brick.BrickId;
import io.brickmux.process.ProcessFingerprint;

/**
 * Tests for {@link ProcessRegistry}.
 */
public class ProcessRegistryTest {

    private static final CompatibilityKey KEY = CompatibilityKey.shared(Collections.emptyMap());
    private static final CompatibilityKey OTHER_KEY =
            CompatibilityKey.shared(Collections.singletonMap("write-behind.trickling-writes", "on"));
    private static final BrickId BRICK_1 = new BrickId("vol1", "peer-1", "/b1");
    private static final BrickId BRICK_2 = new BrickId("vol2", "peer-1", "/b1");

    private ProcessRegistry registry;

    @Before
    public void beforeEach() {
        registry = new ProcessRegistry(new KeyLockTable(false));
    }

    private ProcessEntry newEntry(CompatibilityKey key, long pid) {
        return new ProcessEntry(new ProcessFingerprint(pid, pid * 10), 50000 + (int) pid, key, registry.newEpoch());
    }

    @Test(expected = IllegalStateException.class)
    public void testInsertRequiresLock() {
        registry.insert(newEntry(KEY, 1));
    }

    @Test
    public void testOtherKeysLockDoesNotCount() {
        ReentrantLock lock = registry.getLock(OTHER_KEY);
        lock.lock();
        try {
            registry.insert(newEntry(KEY, 1));
            fail("expected exception");
        } catch (IllegalStateException e) {
            // expected
        } finally {
            lock.unlock();
        }
    }

    @Test
    public void testNewestEntryIsAttachmentPoint() {
        ProcessEntry first = newEntry(KEY, 1);
        ProcessEntry second = newEntry(KEY, 2);
        assertTrue(second.getEpoch() > first.getEpoch());
        ReentrantLock lock = registry.getLock(KEY);
        lock.lock();
        try {
            registry.insert(first);
            registry.insert(second);
            registry.attachBrick(first, BRICK_1);
            registry.attachBrick(second, BRICK_2);
        } finally {
            lock.unlock();
        }
        assertEquals(second, registry.lookup(KEY).get());
        assertEquals(Arrays.asList(second, first), registry.lookupAll(KEY));
        assertEquals(first, registry.lookup(KEY, entry -> entry.getEpoch() == first.getEpoch()).get());
        assertEquals(first, registry.lookupByPid(1).get());
        assertEquals(second, registry.lookupByBrick(BRICK_2).get());
        assertFalse(registry.lookup(OTHER_KEY).isPresent());
        assertEquals(2, registry.getEntries().size());
    }

    @Test
    public void testDetachLastBrickRemovesEntry() {
        ProcessEntry entry = newEntry(KEY, 1);
        ReentrantLock lock = registry.getLock(KEY);
        lock.lock();
        try {
            registry.insert(entry);
            registry.attachBrick(entry, BRICK_1);
            registry.attachBrick(entry, BRICK_2);
            assertEquals(2, entry.getBrickCount());

            assertFalse(registry.detachBrick(entry, BRICK_1));
            assertFalse(registry.lookupByBrick(BRICK_1).isPresent());
            assertTrue(registry.contains(entry));

            assertTrue(registry.detachBrick(entry, BRICK_2));
        } finally {
            lock.unlock();
        }
        assertFalse(registry.contains(entry));
        assertFalse(registry.lookup(KEY).isPresent());
        assertFalse(registry.lookupByPid(1).isPresent());
        assertTrue(registry.getEntries().isEmpty());
    }

    @Test
    public void testRemoveDetachesAllBricks() {
        ProcessEntry entry = newEntry(KEY, 1);
        ReentrantLock lock = registry.getLock(KEY);
        lock.lock();
        try {
            registry.insert(entry);
            registry.attachBrick(entry, BRICK_1);
            registry.attachBrick(entry, BRICK_2);
            assertEquals(entry.getBricks(), registry.remove(entry));
        } finally {
            lock.unlock();
        }
        assertFalse(registry.lookupByBrick(BRICK_1).isPresent());
        assertFalse(registry.lookupByBrick(BRICK_2).isPresent());
    }

    @Test(expected = IllegalStateException.class)
    public void testBrickCantBeInTwoEntries() {
        ProcessEntry first = newEntry(KEY, 1);
        ProcessEntry second = newEntry(KEY, 2);
        ReentrantLock lock = registry.getLock(KEY);
        lock.lock();
        try {
            registry.insert(first);
            registry.insert(second);
            registry.attachBrick(first, BRICK_1);
            registry.attachBrick(second, BRICK_1);
        } finally {
            lock.unlock();
        }
    }

    @Test
    public void testOfflineEpochs() {
        assertEquals(0, registry.getOfflineEpoch(BRICK_1));
        ProcessEntry before = newEntry(KEY, 1);
        registry.markOffline(BRICK_1);
        assertEquals(before.getEpoch(), registry.getOfflineEpoch(BRICK_1));
        ProcessEntry after = newEntry(KEY, 2);
        assertTrue(after.getEpoch() > registry.getOfflineEpoch(BRICK_1));

        // attaching clears the offline mark
        ReentrantLock lock = registry.getLock(KEY);
        lock.lock();
        try {
            registry.insert(after);
            registry.attachBrick(after, BRICK_1);
        } finally {
            lock.unlock();
        }
        assertEquals(0, registry.getOfflineEpoch(BRICK_1));
    }

    @Test
    public void testClear() {
        ProcessEntry entry = newEntry(KEY, 1);
        ReentrantLock lock = registry.getLock(KEY);
        lock.lock();
        try {
            registry.insert(entry);
            registry.attachBrick(entry, BRICK_1);
        } finally {
            lock.unlock();
        }
        registry.markOffline(BRICK_2);
        registry.clear();
        assertTrue(registry.getEntries().isEmpty());
        assertFalse(registry.lookupByBrick(BRICK_1).isPresent());
        assertEquals(0, registry.getOfflineEpoch(BRICK_2));
        assertEquals(1, registry.newEpoch());
    }
}
