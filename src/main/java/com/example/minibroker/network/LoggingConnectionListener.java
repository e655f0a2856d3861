package com.example.minibroker.network;

import lombok.extern.slf4j.Slf4j;

import java.net.SocketAddress;

/**
 * ConnectionListener that writes every event to the application log.
 */
@Slf4j
public class LoggingConnectionListener implements ConnectionListener {

    @Override
    public void connectionOpened(SocketAddress remoteAddress) {
        log.info("Accepted new connection from {}", remoteAddress);
    }

    @Override
    public void requestReceived(SocketAddress remoteAddress, RequestHeader request) {
        log.info("Received request with correlation ID: {} (api key {}, version {})",
                request.getCorrelationId(), request.getRequestApiKey(), request.getRequestApiVersion());
    }

    @Override
    public void responseSent(SocketAddress remoteAddress, ResponseHeader response) {
        log.debug("Sent response with correlation ID: {} to {}", response.getCorrelationId(), remoteAddress);
    }

    @Override
    public void readFailed(SocketAddress remoteAddress, ReadFailureException failure) {
        log.error("Could not parse request from {}: {}", remoteAddress, failure.getMessage());
    }

    @Override
    public void writeFailed(SocketAddress remoteAddress, WriteFailureException failure) {
        log.error("Could not send response to {}", remoteAddress, failure);
    }

    @Override
    public void connectionClosed(SocketAddress remoteAddress) {
        log.info("Connection from {} closed", remoteAddress);
    }
}
