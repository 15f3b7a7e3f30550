package io.brickmux.util;

import java.io.File;
import java.util.Map;

/**
 * Utilities relating to construction of {@link ProcessBuilder}s.
 */
public class ProcessBuilderUtils {
    private ProcessBuilderUtils() {
        // do not instantiate
    }

    /**
     * Returns a {@link ProcessBuilder} instance which has been initialized with the provided command and environment.
     * Output of the process is inherited from the current process.
     */
    public static ProcessBuilder buildProcess(String cmd, Map<String, String> env) {
        ProcessBuilder builder = new ProcessBuilder("/bin/bash", "-c", cmd).inheritIO();
        builder.environment().putAll(env);
        return builder;
    }

    /**
     * Returns a {@link ProcessBuilder} like {@link #buildProcess(String, Map)}, except that output of the process is
     * appended to the provided log file.
     */
    public static ProcessBuilder buildProcess(String cmd, Map<String, String> env, File logFile) {
        ProcessBuilder builder = new ProcessBuilder("/bin/bash", "-c", cmd)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile));
        builder.environment().putAll(env);
        return builder;
    }
}
