package de.ovgu.commitminer.util;

/**
 * A worker of a {@link LineageWorkerPool} died from an exception its work item did not handle, e.g., an out of
 * memory error.  The items left in its lineage were not processed.
 */
public class UncaughtWorkerThreadException extends Exception {
    private final String workerName;

    public UncaughtWorkerThreadException(String workerName, Throwable cause) {
        super("Worker thread " + workerName + " died: " + cause, cause);
        this.workerName = workerName;
    }

    public String getWorkerName() {
        return workerName;
    }
}
