package de.ovgu.commitminer.util;

import java.util.Optional;

/**
 * Thrown when an external program cannot be started, times out or exits with a non-zero exit code.
 */
public class ExternalCommandException extends RuntimeException {
    private final ExternalCommand.Result result;

    public ExternalCommandException(String message, Throwable cause) {
        super(message, cause);
        this.result = null;
    }

    public ExternalCommandException(String message, ExternalCommand.Result result) {
        super(message);
        this.result = result;
    }

    /**
     * @return The result of the command, if it was started at all
     */
    public Optional<ExternalCommand.Result> getResult() {
        return Optional.ofNullable(result);
    }
}
