package com.example.minibroker.network;

import java.net.SocketAddress;

/**
 * Receives the diagnostic events of client connections.
 * Injected into every ConnectionHandler so the framing logic does not depend on a log sink.
 */
public interface ConnectionListener {

    void connectionOpened(SocketAddress remoteAddress);

    void requestReceived(SocketAddress remoteAddress, RequestHeader request);

    void responseSent(SocketAddress remoteAddress, ResponseHeader response);

    void readFailed(SocketAddress remoteAddress, ReadFailureException failure);

    void writeFailed(SocketAddress remoteAddress, WriteFailureException failure);

    void connectionClosed(SocketAddress remoteAddress);
}
