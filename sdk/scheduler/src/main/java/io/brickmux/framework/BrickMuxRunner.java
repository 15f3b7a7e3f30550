package io.brickmux.framework;

import io.brickmux.curator.CuratorPersister;
import io.brickmux.http.endpoints.ClusterOptionsResource;
import io.brickmux.http.endpoints.VolumesResource;
import io.brickmux.mux.BrickMuxScheduler;
import io.brickmux.mux.MuxOptionsConfig;
import io.brickmux.mux.ReconcileException;
import io.brickmux.process.CommandBrickProcessLauncher;
import io.brickmux.process.HttpBrickServiceClient;
import io.brickmux.storage.MemPersister;
import io.brickmux.storage.Persister;
import io.brickmux.util.LoggingUtils;

import org.slf4j.Logger;

import java.io.IOException;
import java.util.Arrays;

/**
 * Main entry point: loads configuration from the environment, reconciles brick processes against persisted state, and
 * then serves the API.
 */
public class BrickMuxRunner {

    private static final Logger LOGGER = LoggingUtils.getLogger(BrickMuxRunner.class);

    private final BrickMuxConfig config;

    public BrickMuxRunner(BrickMuxConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        final BrickMuxConfig config;
        try {
            config = BrickMuxConfig.fromEnv();
        } catch (EnvStore.ConfigException e) {
            LOGGER.error("Invalid configuration", e);
            ProcessExit.exit(ProcessExit.INITIALIZATION_FAILURE, e);
            return;
        }
        new BrickMuxRunner(config).run();
    }

    public void run() {
        final BrickMuxScheduler scheduler;
        try {
            scheduler = buildScheduler(buildPersister());
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to initialize scheduler", e);
            ProcessExit.exit(ProcessExit.INITIALIZATION_FAILURE, e);
            return;
        }

        try {
            scheduler.reconcile();
        } catch (ReconcileException e) {
            LOGGER.error("Failed to reconcile brick processes", e);
            ProcessExit.exit(ProcessExit.RECONCILIATION_FAILURE, e);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::shutdown, "scheduler-shutdown"));

        ApiServer apiServer = ApiServer.start(
                config,
                Arrays.asList(new VolumesResource(scheduler), new ClusterOptionsResource(scheduler)),
                () -> LOGGER.info("Scheduler is ready"));
        apiServer.join();
    }

    private Persister buildPersister() {
        if (config.getZkConnection().isPresent()) {
            LOGGER.info("Storing state for cluster {} in ZooKeeper at {}",
                    config.getClusterName(), config.getZkConnection().get());
            return CuratorPersister.newBuilder(config.getClusterName(), config.getZkConnection().get()).build();
        }
        LOGGER.warn("ZooKeeper connection isn't configured: state is kept in memory and is lost on restart");
        return MemPersister.newBuilder().setExitOnDeadlock(config.isDeadlockExitEnabled()).build();
    }

    private BrickMuxScheduler buildScheduler(Persister persister) throws IOException {
        MuxOptionsConfig muxOptionsConfig = config.getMuxOptionsFile().isPresent()
                ? MuxOptionsConfig.load(config.getMuxOptionsFile().get())
                : MuxOptionsConfig.loadDefault();
        LOGGER.info("Mux-sensitive options: {}", muxOptionsConfig.getRules());
        return BrickMuxScheduler.newBuilder(
                persister,
                new CommandBrickProcessLauncher(
                        config.getBrickCommandTemplate(),
                        config.getProcessStartupGracePeriod(),
                        config.getBrickLogDir()))
                .setMuxOptionsConfig(muxOptionsConfig)
                .setServiceClient(new HttpBrickServiceClient(config.getAttachTimeout()))
                .setLivenessPollInterval(config.getLivenessPollInterval())
                .setStopGracePeriod(config.getProcessStopGracePeriod())
                .setPortRange(config.getBrickPortMin(), config.getBrickPortMax())
                .setExitOnDeadlock(config.isDeadlockExitEnabled())
                .build();
    }
}
