package strata.spi;

/**
 * SPI for observing cache events.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and may also be
 * registered programmatically with the event dispatcher. Handlers run on the dispatcher's
 * thread and must not block.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 * </ul>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/strata.spi.CacheEventHandler}
 */
public interface CacheEventHandler {

    String name();

    default String description() {
        return name() + " cache event handler";
    }

    /**
     * Higher priority handlers are invoked first.
     */
    default int priority() {
        return 0;
    }

    /**
     * Handlers whose dependencies are missing return false and receive no events.
     */
    default boolean isAvailable() {
        return true;
    }

    void handle(CacheEvent event);
}
