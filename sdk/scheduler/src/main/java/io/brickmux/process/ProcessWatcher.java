package io.brickmux.process;

/**
 * Notifies listeners when watched processes exit, by any means.
 */
public interface ProcessWatcher {

    /**
     * Callback for process exits.
     */
    interface ExitListener {
        /**
         * Invoked at most once per watched process lifetime, never on the thread which registered the watch.
         */
        void onProcessExit(ProcessFingerprint fingerprint);
    }

    /**
     * Starts watching the provided process. If it has already exited, the listener is notified right away.
     */
    void watch(ProcessFingerprint fingerprint, ExitListener listener);

    /**
     * Stops watching the provided process without notifying its listener. Used before stopping a process on purpose.
     */
    void unwatch(ProcessFingerprint fingerprint);

    /**
     * Stops all watches without notifying any listeners.
     */
    void unwatchAll();

    /**
     * Stops all watches and releases any threads.
     */
    void close();
}
