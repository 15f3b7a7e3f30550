package io.brickmux.framework;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;

/**
 * This class handles exiting the scheduler process, after completed teardown or after a fatal error.
 */
public class ProcessExit {

    public static final Code INITIALIZATION_FAILURE = new Code(1, "INITIALIZATION_FAILURE");
    public static final Code RECONCILIATION_FAILURE = new Code(2, "RECONCILIATION_FAILURE");
    public static final Code API_SERVER_ERROR = new Code(9, "API_SERVER_ERROR");
    public static final Code DEADLOCK_ENCOUNTERED = new Code(14, "DEADLOCK_ENCOUNTERED");

    private ProcessExit() {
        // do not instantiate
    }

    /**
     * Immediately exits the process with the value of the provided {@link Code}.
     */
    @SuppressWarnings("DM_EXIT")
    public static void exit(Code code) {
        String message = String.format("Process exiting immediately with code: %s[%d]", code, code.getValue());
        System.err.println(message);
        System.out.println(message);
        System.err.println("Printing final thread state...");
        for (ThreadInfo info : ManagementFactory.getThreadMXBean().dumpAllThreads(true, true)) {
            System.err.print(info);
        }
        System.exit(code.getValue());
    }

    /**
     * Similar to {@link #exit(Code)}, except also prints the stack trace of the provided exception before
     * exiting the process. This may be used in contexts where the process is exiting in response to a thrown exception.
     */
    public static void exit(Code code, Throwable e) {
        e.printStackTrace(System.err);
        e.printStackTrace(System.out);
        exit(code);
    }

    /**
     * A reason for the scheduler process to exit.
     */
    public static class Code {
        private final int value;
        private final String name;

        private Code(int value, String name) {
            this.value = value;
            this.name = name;
        }

        public int getValue() {
            return value;
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
