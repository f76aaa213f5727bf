package atrium.adapter.out.telemetry;

import org.jboss.logging.Logger;

import atrium.spi.SecurityEvent;
import atrium.spi.SecurityEventHandler;

/**
 * Security event handler that writes the audit trail using JBoss Logging.
 *
 * <p>Log levels follow event severity:
 * <ul>
 *   <li>INFO severity → DEBUG level</li>
 *   <li>WARNING severity → WARN level</li>
 *   <li>CRITICAL severity → ERROR level</li>
 * </ul>
 */
public class LoggingSecurityEventHandler implements SecurityEventHandler {

    private static final Logger LOG = Logger.getLogger("atrium.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(SecurityEvent event) {
        final var message = event.describe();
        switch (event.severity()) {
            case INFO -> LOG.debug(message);
            case WARNING -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }
}
