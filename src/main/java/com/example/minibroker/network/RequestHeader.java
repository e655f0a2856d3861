package com.example.minibroker.network;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-layout Kafka request header as decoded from the wire.
 * api key and api version are unsigned 16 bit values on the wire, held as ints here
 */
@Value
@Builder
public class RequestHeader {
    int messageSize; // declared size of header + body, not validated
    int requestApiKey;
    int requestApiVersion;
    int correlationId; // echoed back verbatim in the response
    String clientId; // never populated by this broker
    @Builder.Default
    List<String> tagBuffer = Collections.emptyList();

    public Optional<String> getClientId() {
        return Optional.ofNullable(clientId);
    }
}
