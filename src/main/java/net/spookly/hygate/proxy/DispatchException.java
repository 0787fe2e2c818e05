package net.spookly.hygate.proxy;

/**
 * Dispatch failure surfaced to the caller. The message is safe to show to clients.
 */
public class DispatchException extends RuntimeException {
    private final DispatchError error;

    public DispatchException(DispatchError error, String message) {
        super(message);
        this.error = error;
    }

    public DispatchException(DispatchError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public DispatchError error() {
        return error;
    }
}
