package io.cardfed.core;

/**
 * Programming error: an operation was called outside its domain,
 * e.g. asking a local user id for the card it was derived from.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
