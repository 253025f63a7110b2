package dev.configkit.core.validation.rules;

import dev.configkit.core.ConfigValidationError;
import dev.configkit.core.validation.PropertyRef;
import dev.configkit.core.validation.PropertyRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.List;
import java.util.Optional;

/**
 * Fails when a port number is out of range or cannot be bound on the loopback interface.
 * <p>
 * The check binds and immediately releases a listener, so it is best-effort only: another
 * process may take the port between validation and the application's own bind.
 */
public final class PortAvailableRule<T> extends PropertyRule<T, Integer> {

    private static final Logger logger = LoggerFactory.getLogger(PortAvailableRule.class);

    static final int MIN_PORT = 1;
    static final int MAX_PORT = 65535;

    public PortAvailableRule(PropertyRef<T, Integer> property, String customMessage) {
        super(property, customMessage);
    }

    @Override
    public Optional<ConfigValidationError> validate(T options, String sectionName) {
        Integer port = valueOf(options);

        if (port == null || port < MIN_PORT || port > MAX_PORT) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    "Port number must be between " + MIN_PORT + " and " + MAX_PORT + " (current: " + port + ")",
                    port,
                    List.of("Use a valid port number")));
        }

        if (!isPortAvailable(port)) {
            return Optional.of(new ConfigValidationError(
                    key(sectionName),
                    messageOr("Port " + port + " is already in use"),
                    port,
                    List.of("Choose a different port or stop the service using this port")));
        }

        return Optional.empty();
    }

    private static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(InetAddress.getLoopbackAddress(), port));
            return true;
        } catch (IOException e) {
            logger.debug("Port {} could not be bound: {}", port, e.getMessage());
            return false;
        }
    }
}
