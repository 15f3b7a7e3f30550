package io.brickmux.process;

/**
 * A freshly spawned brick-server process.
 */
public final class BrickProcess {

    private final ProcessFingerprint fingerprint;
    private final int port;

    public BrickProcess(ProcessFingerprint fingerprint, int port) {
        this.fingerprint = fingerprint;
        this.port = port;
    }

    public ProcessFingerprint getFingerprint() {
        return fingerprint;
    }

    public int getPort() {
        return port;
    }

    @Override
    public String toString() {
        return String.format("%s port=%d", fingerprint, port);
    }
}
