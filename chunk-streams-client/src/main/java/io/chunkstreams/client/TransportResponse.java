package io.chunkstreams.client;

import java.util.List;
import java.util.Map;

/**
 * Status, headers and body of a transport response. The caller owns the body.
 */
public record TransportResponse<T>(int status, Map<String, List<String>> headers, T body) {

    public TransportResponse {
        headers = headers == null ? Map.of() : headers;
    }

    public boolean isOk() {
        return status == 200;
    }
}
