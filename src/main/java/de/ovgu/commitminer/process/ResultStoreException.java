package de.ovgu.commitminer.process;

public class ResultStoreException extends RuntimeException {
    public ResultStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
