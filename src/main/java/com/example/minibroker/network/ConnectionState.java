package com.example.minibroker.network;

/**
 * Lifecycle of a single client connection.
 */
public enum ConnectionState {
    AWAITING_REQUEST,
    PROCESSING,
    CLOSED
}
