package io.brickmux.mux;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.brickmux.brick.Brick;
import io.brickmux.brick.BrickId;
import io.brickmux.brick.BrickRuntime;
import io.brickmux.brick.BrickRuntimeInfo;
import io.brickmux.brick.BrickState;
import io.brickmux.process.PortAllocator;
import io.brickmux.process.ProcessFingerprint;
import io.brickmux.state.BrickStore;
import io.brickmux.state.ClusterOptionStore;
import io.brickmux.state.StateStoreException;
import io.brickmux.storage.MemPersister;
import io.brickmux.storage.Persister;
import io.brickmux.storage.StorageError.Reason;
import io.brickmux.testutils.FakeBrickServers;

/**
 * Tests for {@link RecoveryReconciler}. Each test starts bricks with one set of components, then rebuilds the
 * registry with a fresh set over the same persisted state and the same running processes, as a restart would.
 */
public class RecoveryReconcilerTest {

    private static final Map<String, String> MUX_ON = Collections.singletonMap("cluster.brick-multiplex", "on");
    private static final BrickId V1_B1 = new BrickId("vol1", "peer-1", "/bricks/vol1/b1");
    private static final BrickId V1_B2 = new BrickId("vol1", "peer-1", "/bricks/vol1/b2");
    private static final BrickId V2_B1 = new BrickId("vol2", "peer-1", "/bricks/vol2/b1");
    private static final BrickId V3_B1 = new BrickId("vol3", "peer-1", "/bricks/vol3/b1");

    @Mock private BrickStore mockBrickStore;

    private FakeBrickServers servers;
    private Persister persister;
    private MuxOptionsConfig config;

    /**
     * One generation of in-memory scheduler state.
     */
    private class Generation {
        private final BrickStore brickStore = new BrickStore(persister);
        private final ProcessRegistry registry = new ProcessRegistry(new KeyLockTable(false));
        private final PortAllocator portAllocator = new PortAllocator(53000, 53999);
        private final LivenessMonitor monitor = new LivenessMonitor(registry, servers, brickStore, portAllocator);
        private final CompatibilityClassifier classifier = new CompatibilityClassifier(config);
        private final AttachmentEngine engine = new AttachmentEngine(
                registry, classifier, monitor, servers, servers, servers, portAllocator, brickStore, Duration.ZERO);
        private final RecoveryReconciler reconciler = new RecoveryReconciler(
                registry, classifier, monitor, servers, portAllocator, brickStore, new ClusterOptionStore(persister));

        private BrickRuntimeInfo start(BrickId brick, boolean force) throws Exception {
            return engine.startBrick(toBrick(brick), force);
        }

        private void stop(BrickId brick) {
            engine.stopBrick(toBrick(brick));
        }

        private Brick toBrick(BrickId brick) {
            Map<String, String> options = new HashMap<>(new ClusterOptionStore(persister).fetchOptions());
            options.putAll(brickStore.fetchVolumeOptions(brick.getVolume()));
            return new Brick(brick, options);
        }

        private Map<ProcessFingerprint, Set<BrickId>> snapshot() {
            Map<ProcessFingerprint, Set<BrickId>> groups = new HashMap<>();
            for (ProcessEntry entry : registry.getEntries()) {
                groups.put(entry.getFingerprint(), new TreeSet<>(entry.getBricks()));
            }
            return groups;
        }
    }

    @Before
    public void beforeEach() throws Exception {
        MockitoAnnotations.initMocks(this);
        servers = new FakeBrickServers();
        persister = MemPersister.newBuilder().setExitOnDeadlock(false).build();
        config = MuxOptionsConfig.loadDefault();

        ClusterOptionStore clusterOptionStore = new ClusterOptionStore(persister);
        clusterOptionStore.storeOptions(MUX_ON);
        BrickStore brickStore = new BrickStore(persister);
        brickStore.storeVolume("vol1", Collections.emptyMap(), Arrays.asList(V1_B1, V1_B2));
        brickStore.storeVolume("vol2", Collections.emptyMap(), Collections.singletonList(V2_B1));
        brickStore.storeVolume("vol3",
                Collections.singletonMap("write-behind.trickling-writes", "on"), Collections.singletonList(V3_B1));
    }

    private Generation startAll() throws Exception {
        Generation before = new Generation();
        before.reconciler.reconcile();
        for (BrickId brick : Arrays.asList(V1_B1, V1_B2, V2_B1, V3_B1)) {
            before.start(brick, false);
        }
        assertEquals(2, servers.getLaunchCount());
        return before;
    }

    @Test
    public void testLiveProcessesAreRecovered() throws Exception {
        Generation before = startAll();

        Generation after = new Generation();
        after.reconciler.reconcile();
        assertEquals(before.snapshot(), after.snapshot());
        assertEquals(2, servers.getLaunchCount());
        for (ProcessEntry entry : after.registry.getEntries()) {
            assertTrue(servers.isWatched(entry.getFingerprint()));
            assertEquals(before.registry.lookupByPid(entry.getPid()).get().getPort(), entry.getPort());
            assertEquals(before.registry.lookupByPid(entry.getPid()).get().getKey(), entry.getKey());
        }
    }

    @Test
    public void testReconcileIsIdempotent() throws Exception {
        startAll();
        Generation after = new Generation();
        after.reconciler.reconcile();
        Map<ProcessFingerprint, Set<BrickId>> first = after.snapshot();
        Map<BrickId, BrickRuntime> firstRuntimes = after.brickStore.fetchAllRuntimes();

        after.reconciler.reconcile();
        assertEquals(first, after.snapshot());
        Map<BrickId, BrickState> states = new TreeMap<>();
        for (Map.Entry<BrickId, BrickRuntime> entry : after.brickStore.fetchAllRuntimes().entrySet()) {
            states.put(entry.getKey(), entry.getValue().getState());
            assertEquals(firstRuntimes.get(entry.getKey()).getState(), entry.getValue().getState());
        }
        assertEquals(4, states.size());
    }

    @Test
    public void testDeadProcessBricksGoOffline() throws Exception {
        Generation before = startAll();
        ProcessFingerprint shared = before.registry.lookupByBrick(V1_B1).get().getFingerprint();
        servers.crashSilently(shared);

        Generation after = new Generation();
        after.reconciler.reconcile();
        assertEquals(BrickState.OFFLINE, after.brickStore.fetchRuntime(V1_B1).getState());
        assertEquals(BrickState.OFFLINE, after.brickStore.fetchRuntime(V1_B2).getState());
        assertEquals(BrickState.OFFLINE, after.brickStore.fetchRuntime(V2_B1).getState());
        assertEquals(BrickState.ONLINE, after.brickStore.fetchRuntime(V3_B1).getState());
        assertEquals(1, after.registry.getEntries().size());
        assertEquals(2, servers.getLaunchCount());

        // a second pass changes nothing
        after.reconciler.reconcile();
        assertEquals(1, after.registry.getEntries().size());
        assertEquals(BrickState.OFFLINE, after.brickStore.fetchRuntime(V1_B1).getState());
        assertEquals(2, servers.getLaunchCount());
    }

    @Test
    public void testForcedStartsConvergeAfterRecovery() throws Exception {
        Generation before = startAll();
        servers.crashSilently(before.registry.lookupByBrick(V1_B1).get().getFingerprint());

        Generation after = new Generation();
        after.reconciler.reconcile();
        BrickRuntimeInfo v1 = after.start(V1_B1, true);
        assertEquals(v1, after.start(V1_B2, true));
        assertEquals(v1, after.start(V2_B1, true));
        assertEquals(3, servers.getLaunchCount());
        assertEquals(2, after.registry.getEntries().size());
    }

    @Test
    public void testRecoveredProcessIsAttachmentPoint() throws Exception {
        Generation before = startAll();
        BrickRuntimeInfo shared = before.start(V1_B1, false);
        before.stop(V2_B1);

        Generation after = new Generation();
        after.reconciler.reconcile();
        assertEquals(shared, after.start(V2_B1, false));
        assertEquals(shared, after.start(V2_B1, true));
        assertEquals(2, servers.getLaunchCount());
    }

    @Test
    public void testRecoveredExitIsDetected() throws Exception {
        Generation before = startAll();
        ProcessFingerprint shared = before.registry.lookupByBrick(V1_B1).get().getFingerprint();

        Generation after = new Generation();
        after.reconciler.reconcile();
        servers.crash(shared);
        assertEquals(BrickState.OFFLINE, after.brickStore.fetchRuntime(V1_B1).getState());
        assertEquals(BrickState.OFFLINE, after.brickStore.fetchRuntime(V2_B1).getState());
        assertFalse(after.registry.lookupByPid(shared.getPid()).isPresent());
    }

    @Test
    public void testStoppedBricksStayStopped() throws Exception {
        Generation before = startAll();
        before.stop(V3_B1);

        Generation after = new Generation();
        after.reconciler.reconcile();
        assertEquals(BrickState.NOT_STARTED, after.brickStore.fetchRuntime(V3_B1).getState());
        assertFalse(after.registry.lookupByBrick(V3_B1).isPresent());
        assertEquals(1, after.registry.getEntries().size());
    }

    @Test
    public void testEmptyState() throws Exception {
        Generation generation = new Generation();
        persister.recursiveDelete("Volumes");
        persister.recursiveDelete("ClusterOptions");
        generation.reconciler.reconcile();
        assertTrue(generation.registry.getEntries().isEmpty());
    }

    @Test
    public void testReadFailure() throws Exception {
        when(mockBrickStore.fetchAllRuntimes())
                .thenThrow(new StateStoreException(Reason.STORAGE_ERROR, "disconnected"));
        Generation generation = new Generation();
        RecoveryReconciler reconciler = new RecoveryReconciler(
                generation.registry,
                generation.classifier,
                generation.monitor,
                servers,
                generation.portAllocator,
                mockBrickStore,
                new ClusterOptionStore(persister));
        try {
            reconciler.reconcile();
            fail("expected exception");
        } catch (ReconcileException e) {
            assertTrue(e.getCause() instanceof StateStoreException);
        }
    }

    @Test
    public void testGroupsOfRecoveredProcesses() throws Exception {
        startAll();
        Generation after = new Generation();
        after.reconciler.reconcile();
        List<ProcessEntry> entries = after.registry.getEntries();
        assertEquals(2, entries.size());
        Set<BrickId> shared = after.registry.lookupByBrick(V1_B1).get().getBricks();
        assertEquals(new TreeSet<>(Arrays.asList(V1_B1, V1_B2, V2_B1)), shared);
        assertEquals(Collections.singleton(V3_B1), after.registry.lookupByBrick(V3_B1).get().getBricks());
    }
}
