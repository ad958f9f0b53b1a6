package strata.spi;

/**
 * Thrown when the remote tier cannot be opened or no backend is available.
 *
 * <p>Data operations never throw this; they degrade to misses instead.
 */
public class RemoteTierException extends RuntimeException {

    public RemoteTierException(String message) {
        super(message);
    }

    public RemoteTierException(String message, Throwable cause) {
        super(message, cause);
    }
}
