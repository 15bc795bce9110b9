package de.ovgu.commitminer.vcs;

/**
 * A git operation failed.
 */
public class VersionControlException extends RuntimeException {
    public VersionControlException(String message) {
        super(message);
    }

    public VersionControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
