package de.ovgu.commitminer.main;

/**
 * The run cannot start: the repository cannot be cloned or read, the ruleset is missing, the working trees cannot be
 * created, ...  Always fatal.
 */
public class SetupException extends RuntimeException {
    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
