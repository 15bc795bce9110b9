package de.ovgu.commitminer.analysis;

/**
 * The analyzer could not produce findings for a commit.
 */
public class AnalysisException extends RuntimeException {
    public enum Cause {
        /**
         * The analyzer process exited with an unexpected code
         */
        EXIT_CODE,
        /**
         * The analyzer did not finish in time
         */
        TIMEOUT,
        /**
         * The report is missing or cannot be parsed
         */
        REPORT,
        /**
         * The daemon could not be reached or the connection broke
         */
        TRANSPORT,
        /**
         * The daemon answered with an error status
         */
        SERVER,
        /**
         * Local files needed for the call could not be written or read
         */
        IO
    }

    private final Cause cause;
    private final boolean retryable;

    public AnalysisException(Cause cause, String message) {
        this(cause, message, null, false);
    }

    public AnalysisException(Cause cause, String message, Throwable throwable) {
        this(cause, message, throwable, false);
    }

    public AnalysisException(Cause cause, String message, Throwable throwable, boolean retryable) {
        super(message, throwable);
        this.cause = cause;
        this.retryable = retryable;
    }

    public Cause getFailureCause() {
        return cause;
    }

    /**
     * @return <code>true</code> if the same call might succeed when repeated
     */
    public boolean isRetryable() {
        return retryable;
    }
}
