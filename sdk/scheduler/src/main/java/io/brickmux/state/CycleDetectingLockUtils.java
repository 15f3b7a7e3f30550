package io.brickmux.state;

import io.brickmux.framework.ProcessExit;

import com.google.common.util.concurrent.CycleDetectingLockFactory;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Common construction of thread locks that immediately log and kill the process if a deadlock is detected.
 */
public final class CycleDetectingLockUtils {

    /**
     * A custom deadlock policy which logs the error, and then exits the process.
     * After exiting, the process should then be restarted by its supervisor in a fresh state.
     */
    private static final CycleDetectingLockFactory.Policy LOG_AND_EXIT_POLICY =
            e -> ProcessExit.exit(ProcessExit.DEADLOCK_ENCOUNTERED, e);

    private CycleDetectingLockUtils() {
        // do not instantiate
    }

    /**
     * Returns a new cycle detecting read/write lock instance which has the provided label.
     *
     * @param exitOnDeadlock whether to exit the process if a deadlock is detected
     * @param parentClass    to be used in any error messages
     */
    public static ReadWriteLock newLock(boolean exitOnDeadlock, Class<?> parentClass) {
        return getFactory(exitOnDeadlock).newReentrantReadWriteLock(parentClass.getSimpleName());
    }

    /**
     * Returns a new cycle detecting exclusive lock instance with the provided label.
     *
     * @param exitOnDeadlock whether to exit the process if a deadlock is detected
     * @param lockName       to be used in any error messages
     */
    public static ReentrantLock newReentrantLock(boolean exitOnDeadlock, String lockName) {
        return getFactory(exitOnDeadlock).newReentrantLock(lockName);
    }

    private static CycleDetectingLockFactory getFactory(boolean exitOnDeadlock) {
        return CycleDetectingLockFactory
                .newInstance(exitOnDeadlock ? LOG_AND_EXIT_POLICY : CycleDetectingLockFactory.Policies.WARN);
    }
}
