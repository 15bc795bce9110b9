package de.ovgu.commitminer.pool;

/**
 * A commit could not be checked out into its working-tree slot, even after retrying.  Affects only that commit.
 */
public class CheckoutException extends RuntimeException {
    public CheckoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
