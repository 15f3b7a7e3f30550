package io.brickmux.process;

import io.brickmux.brick.Brick;
import io.brickmux.brick.BrickId;
import io.brickmux.util.LoggingUtils;
import io.brickmux.util.ProcessBuilderUtils;

import com.github.mustachejava.MustacheException;
import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Launches brick-server processes from a Mustache command template, run through {@code /bin/bash -c}. Templates
 * should {@code exec} the server so that the PID we track is the server itself.
 *
 * <p>Template values: {@code port}, {@code volume}, {@code peer}, {@code brick-path}, {@code brick-name}, {@code key}.
 * The same values are passed to the process as {@code BRICKMUX_*} environment variables.
 */
public class CommandBrickProcessLauncher implements BrickProcessLauncher {

    private static final Logger LOGGER = LoggingUtils.getLogger(CommandBrickProcessLauncher.class);

    private static final String TEMPLATE_NAME = "brick-command";

    private final String commandTemplate;
    private final Duration startupGracePeriod;
    private final Optional<File> logDir;

    public CommandBrickProcessLauncher(String commandTemplate, Duration startupGracePeriod, Optional<File> logDir) {
        this.commandTemplate = commandTemplate;
        this.startupGracePeriod = startupGracePeriod;
        this.logDir = logDir;
    }

    @Override
    public BrickProcess launch(Brick brick, String keyDigest, int port) throws SpawnException {
        Map<String, String> values = getTemplateValues(brick.getId(), keyDigest, port);
        final String command;
        try {
            command = TemplateUtils.renderMustacheThrowIfMissing(TEMPLATE_NAME, commandTemplate, values);
        } catch (MustacheException e) {
            throw new SpawnException(String.format("Failed to render command for brick %s", brick.getId()), e);
        }

        ProcessBuilder builder = logDir.isPresent()
                ? ProcessBuilderUtils.buildProcess(command, getEnv(values),
                        new File(logDir.get(), String.format("brick-%s-%d.log", keyDigest, port)))
                : ProcessBuilderUtils.buildProcess(command, getEnv(values));
        LOGGER.info("Executing command for brick {}: {}", brick.getId(), builder.command());

        final Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new SpawnException(String.format("Failed to start process for brick %s", brick.getId()), e);
        }

        // The process must survive its startup period, otherwise it most likely failed to bind or load the brick.
        try {
            if (process.waitFor(startupGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new SpawnException(String.format(
                        "Process for brick %s exited with code %d during startup",
                        brick.getId(), process.exitValue()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SpawnException(String.format("Interrupted while starting brick %s", brick.getId()), e);
        }

        BrickProcess brickProcess = new BrickProcess(ProcessFingerprint.of(process.toHandle()), port);
        LOGGER.info("Started process for brick {}: {}", brick.getId(), brickProcess);
        return brickProcess;
    }

    @VisibleForTesting
    static Map<String, String> getTemplateValues(BrickId brick, String keyDigest, int port) {
        Map<String, String> values = new TreeMap<>();
        values.put("port", String.valueOf(port));
        values.put("volume", brick.getVolume());
        values.put("peer", brick.getPeer());
        values.put("brick-path", brick.getPath());
        values.put("brick-name", brick.getName());
        values.put("key", keyDigest);
        return values;
    }

    private static Map<String, String> getEnv(Map<String, String> values) {
        Map<String, String> env = new TreeMap<>();
        for (Map.Entry<String, String> entry : values.entrySet()) {
            env.put("BRICKMUX_" + entry.getKey().toUpperCase().replace('-', '_'), entry.getValue());
        }
        return env;
    }
}
