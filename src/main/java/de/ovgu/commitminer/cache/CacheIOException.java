package de.ovgu.commitminer.cache;

/**
 * The cache snapshot could not be read or written.  Never fatal: a cache that cannot be loaded starts out empty.
 */
public class CacheIOException extends RuntimeException {
    public CacheIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
