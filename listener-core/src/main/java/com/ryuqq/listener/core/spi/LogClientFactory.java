package com.ryuqq.listener.core.spi;

/**
 * Factory SPI producing connected log clients.
 *
 * <p>Each listener asks the factory for its own client in {@code start()} and owns it
 * exclusively until it is closed.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LogClientFactory {

    /**
     * Creates a client connected to the broker cluster.
     *
     * @return a new connected client
     * @throws RuntimeException if the connection cannot be established
     */
    LogClient create();
}
