package com.example.minibroker;

import com.example.minibroker.broker.Broker;
import com.example.minibroker.config.BrokerConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Main entry point for the broker server.
 * # Start with default port (9092): java -jar mini-broker.jar
 * # Start with custom port: java -jar mini-broker.jar 9093
 */
@Slf4j
public class Server {

    public static void main(String[] args) {
        try {
            BrokerConfig config = BrokerConfig.load(args, System.getenv());

            Broker broker = new Broker(config);
            broker.start();

            // stop gracefully when running as a service
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down...");
                broker.stop();
                log.info("Shutdown complete");
            }));

            log.info("Broker server started on {}:{}", config.getHost(), broker.getPort());

        } catch (Exception e) {
            log.error("Error starting broker server", e);
            System.exit(1);
        }
    }
}
