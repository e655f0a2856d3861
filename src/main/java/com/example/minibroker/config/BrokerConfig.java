package com.example.minibroker.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Broker settings. Defaults can be overridden by environment variables,
 * and the port by the first command line argument.
 * # java -jar mini-broker.jar          -> 127.0.0.1:9092
 * # java -jar mini-broker.jar 9093     -> 127.0.0.1:9093
 * # BROKER_HOST=0.0.0.0 java -jar mini-broker.jar
 */
@Slf4j
@Value
@Builder
public class BrokerConfig {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 9092;

    public static final String HOST_ENV = "BROKER_HOST";
    public static final String PORT_ENV = "BROKER_PORT";
    public static final String WORKER_THREADS_ENV = "BROKER_WORKER_THREADS";

    @Builder.Default
    String host = DEFAULT_HOST;
    @Builder.Default
    int port = DEFAULT_PORT;
    // 0 lets Netty pick its default (2 * available processors)
    @Builder.Default
    int workerThreads = 0;

    public static BrokerConfig defaults() {
        return BrokerConfig.builder().build();
    }

    public static BrokerConfig load(String[] args, Map<String, String> env) {
        BrokerConfigBuilder builder = BrokerConfig.builder();

        String host = env.get(HOST_ENV);
        if (host != null && !host.isBlank()) {
            builder.host(host.trim());
        }

        Integer port = parsePort(env.get(PORT_ENV), PORT_ENV);
        if (args.length > 0) {
            Integer argPort = parsePort(args[0], "argument");
            if (argPort != null) {
                port = argPort;
            }
        }
        if (port != null) {
            builder.port(port);
        }

        Integer workerThreads = parseInt(env.get(WORKER_THREADS_ENV), WORKER_THREADS_ENV);
        if (workerThreads != null) {
            if (workerThreads < 0) {
                log.warn("Invalid {} {}. Using Netty default", WORKER_THREADS_ENV, workerThreads);
            } else {
                builder.workerThreads(workerThreads);
            }
        }

        return builder.build();
    }

    private static Integer parsePort(String value, String source) {
        Integer port = parseInt(value, source);
        if (port != null && (port < 0 || port > 65535)) {
            log.warn("Port {} from {} is out of range. Using default port {}", port, source, DEFAULT_PORT);
            return null;
        }
        return port;
    }

    private static Integer parseInt(String value, String source) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number {} from {}. Ignoring it", value, source);
            return null;
        }
    }
}
