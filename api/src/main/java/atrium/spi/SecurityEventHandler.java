package atrium.spi;

/**
 * SPI for handling security events detected by the request pipeline.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Register them in
 * {@code META-INF/services/atrium.spi.SecurityEventHandler}.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs events using JBoss Logging (priority 0)</li>
 *   <li>{@code metrics} - Records events as Micrometer metrics (priority 10)</li>
 * </ul>
 */
public interface SecurityEventHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "webhook")
     */
    String name();

    /**
     * Returns the priority of this handler. Higher priority handlers are invoked first.
     *
     * @return priority value
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler is currently available.
     *
     * @return true if handler is available and should receive events
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Handle a security event. Called on the dispatcher thread, never on a request thread.
     *
     * @param event the security event to handle
     */
    void handle(SecurityEvent event);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
