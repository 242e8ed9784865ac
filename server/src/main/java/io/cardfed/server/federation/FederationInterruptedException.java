package io.cardfed.server.federation;

/**
 * The caller was interrupted while waiting for a fan-out; outstanding tasks
 * have been cancelled and the thread's interrupt flag is set again.
 */
public class FederationInterruptedException extends RuntimeException {

    public FederationInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
