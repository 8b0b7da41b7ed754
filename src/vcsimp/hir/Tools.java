package vcsimp.hir;

/**
* Exit handling and timing for the command line front end and the passes.
*/
public final class Tools {

    // When set, exit() throws so that embedding code and tests survive it.
    private static boolean exit_throws_exception = false;

    private Tools() {
    }

    /**
    * Makes {@link #exit(int)} throw a {@link RuntimeException} instead of
    * terminating the JVM.
    */
    public static void exitThrowsException(boolean flag) {
        exit_throws_exception = flag;
    }

    /**
    * Terminates the process with the given status.
    *
    * @throws RuntimeException carrying the status, if
    *   {@link #exitThrowsException(boolean)} was last called with true.
    */
    public static void exit(int status) {
        if (exit_throws_exception) {
            throw new RuntimeException("Exiting with status " + status);
        }
        System.exit(status);
    }

    /** Returns a time stamp in seconds. */
    public static double getTime() {
        return System.nanoTime() / 1.0e9;
    }

    /** Returns the seconds elapsed since a stamp taken with {@link #getTime()}. */
    public static double getTime(double since) {
        return getTime() - since;
    }
}
