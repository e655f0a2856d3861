package com.example.minibroker.network;

import lombok.Value;

/**
 * Response header written back for every request.
 */
@Value
public class ResponseHeader {
    int messageSize;
    int correlationId;

    /**
     * Build the response for a request. The message size is always 0 since no body is produced yet.
     */
    public static ResponseHeader forRequest(RequestHeader request) {
        return new ResponseHeader(0, request.getCorrelationId());
    }
}
