package io.chunkstreams.server.core;

import io.chunkstreams.core.SseFrame;

import java.util.concurrent.Flow;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Sse {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    /**
     * Long-lived event stream. The host subscribes, writes each frame's {@link SseFrame#render()}
     * and cancels the subscription once the observer goes away.
     */
    record Sse(Flow.Publisher<SseFrame> publisher) implements ResponseBody {}
}
