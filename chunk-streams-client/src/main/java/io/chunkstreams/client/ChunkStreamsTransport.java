package io.chunkstreams.client;

import java.io.InputStream;

/**
 * HTTP seam of the client. The body of a streamed response is read until the server closes it.
 */
public interface ChunkStreamsTransport {
    TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception;
}
