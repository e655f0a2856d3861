package com.example.minibroker.broker;

import com.example.minibroker.config.BrokerConfig;
import com.example.minibroker.network.ConnectionListener;
import com.example.minibroker.network.LoggingConnectionListener;
import com.example.minibroker.network.NetworkServer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main broker class, owns the network server and its lifecycle.
 */
@Slf4j
public class Broker {
    private final BrokerConfig config;
    private final ConnectionListener connectionListener;
    private final AtomicBoolean isRunning = new AtomicBoolean(false);
    private NetworkServer networkServer;

    public Broker(BrokerConfig config) {
        this(config, new LoggingConnectionListener());
    }

    public Broker(BrokerConfig config, ConnectionListener connectionListener) {
        this.config = config;
        this.connectionListener = connectionListener;
    }

    /**
     * Start the broker. A bind failure is rethrown and leaves the broker stopped.
     */
    public void start() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Broker is already running");
            return;
        }

        log.info("Starting broker on {}:{}", config.getHost(), config.getPort());

        NetworkServer server = new NetworkServer(config, connectionListener);
        try {
            server.start();
        } catch (RuntimeException e) {
            isRunning.set(false);
            throw e;
        }
        this.networkServer = server;

        log.info("Broker started successfully");
    }

    public void stop() {
        if (!isRunning.compareAndSet(true, false)) {
            return;
        }

        log.info("Stopping broker...");
        networkServer.shutdown();
        networkServer = null;
        log.info("Broker stopped");
    }

    public boolean isRunning() {
        return isRunning.get();
    }

    public int getPort() {
        if (networkServer == null) {
            throw new IllegalStateException("Broker is not running");
        }
        return networkServer.getBoundPort();
    }
}
