package io.brickmux.process;

import static org.junit.Assert.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.Test;

/**
 * Tests for {@link PortAllocator}.
 */
public class PortAllocatorTest {

    /**
     * Treats every port as bindable, so that tests don't depend on what's running on the host.
     */
    private static class UnboundPortAllocator extends PortAllocator {
        private final Set<Integer> bound = new HashSet<>();

        UnboundPortAllocator(int minPort, int maxPort) {
            super(minPort, maxPort);
        }

        @Override
        boolean isBindable(int port) {
            return !bound.contains(port);
        }
    }

    @Test
    public void testAllocateAndRelease() throws Exception {
        PortAllocator allocator = new UnboundPortAllocator(50000, 50002);
        assertEquals(50000, allocator.allocate());
        assertEquals(50001, allocator.allocate());
        assertEquals(50002, allocator.allocate());
        assertTrue(allocator.isAllocated(50001));

        allocator.release(50001);
        assertFalse(allocator.isAllocated(50001));
        assertEquals(50001, allocator.allocate());
    }

    @Test(expected = SpawnException.class)
    public void testExhausted() throws Exception {
        PortAllocator allocator = new UnboundPortAllocator(50000, 50001);
        allocator.allocate();
        allocator.allocate();
        allocator.allocate();
    }

    @Test
    public void testReservedPortsAreSkipped() throws Exception {
        PortAllocator allocator = new UnboundPortAllocator(50000, 50001);
        allocator.reserve(50000);
        assertEquals(50001, allocator.allocate());

        allocator.releaseAll();
        assertFalse(allocator.isAllocated(50000));
        assertFalse(allocator.isAllocated(50001));
    }

    @Test
    public void testPortsBoundElsewhereAreSkipped() throws Exception {
        UnboundPortAllocator allocator = new UnboundPortAllocator(50000, 50002);
        allocator.bound.add(50000);
        allocator.bound.add(50001);
        assertEquals(50002, allocator.allocate());
        assertFalse(allocator.isAllocated(50000));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidRange() {
        new PortAllocator(50001, 50000);
    }
}
