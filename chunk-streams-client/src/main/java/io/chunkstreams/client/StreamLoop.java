package io.chunkstreams.client;

import io.chunkstreams.core.ChunkStreamsException;
import io.chunkstreams.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;

/**
 * Internal implementation of the reconnecting stream loop.
 *
 * <p>This class is not intended to be used directly by clients.
 */
final class StreamLoop {

    private static final Logger log = LoggerFactory.getLogger(StreamLoop.class);

    private final ChunkStreamsTransport transport;
    private final JsonCodec codec;
    private final StreamRequest request;
    private final Duration reconnectDelay;
    private final int maxReconnects;

    StreamLoop(ChunkStreamsTransport transport, JsonCodec codec, StreamRequest request,
               Duration reconnectDelay, int maxReconnects) {
        this.transport = transport;
        this.codec = codec;
        this.request = request;
        this.reconnectDelay = reconnectDelay;
        this.maxReconnects = maxReconnects;
    }

    /**
     * Cold publisher: every subscriber gets its own connection loop, started on subscribe.
     * Cancelling closes the open response body and stops the loop, even while the stream is idle.
     */
    Flow.Publisher<StreamEvent> publisher() {
        return subscriber -> {
            SubmissionPublisher<StreamEvent> pub = new SubmissionPublisher<>();
            Link link = new Link();
            Thread t = new Thread(() -> run(pub, link), "chunk-streams-sse-" + request.key());
            t.setDaemon(true);
            link.thread = t;
            pub.subscribe(new ReleasingSubscriber(subscriber, link));
            t.start();
        };
    }

    private void run(SubmissionPublisher<StreamEvent> pub, Link link) {
        URI url = request.uri();
        TransportRequest req = TransportRequest.eventStream(url);
        int attempt = 0;
        int failures = 0;

        try {
            while (active(pub)) {
                attempt++;
                boolean progressed = false;
                try {
                    TransportResponse<InputStream> resp = transport.sendStream(req);
                    if (!resp.isOk()) {
                        closeQuietly(resp.body());
                        log.warn("Stream rejected: url={}, status={}", url, resp.status());
                        pub.closeExceptionally(new ChunkStreamsException.StreamRejected(
                                resp.status(), "stream rejected with status " + resp.status() + ": " + url));
                        return;
                    }
                    link.body = resp.body();
                    if (!active(pub)) {
                        closeQuietly(resp.body());
                        return;
                    }
                    log.debug("Stream connected: url={}, attempt={}", url, attempt);
                    pub.submit(new StreamEvent.Connected(attempt));

                    try (ChunkReader reader = new ChunkReader(resp.body(), codec)) {
                        StreamEvent ev;
                        while ((ev = reader.next()) != null) {
                            if (!active(pub)) return;
                            pub.submit(ev);
                            if (ev instanceof StreamEvent.Done) {
                                log.debug("Stream done: url={}", url);
                                pub.close();
                                return;
                            }
                            progressed = true;
                        }
                    }
                    if (!active(pub)) return;
                    log.info("Stream ended without end-of-stream sentinel: url={}, attempt={}", url, attempt);
                } catch (IOException e) {
                    if (link.released) {
                        log.debug("Stream cancelled: url={}", url);
                        return;
                    }
                    log.warn("Stream connection failed: url={}, attempt={}", url, attempt, e);
                } finally {
                    link.body = null;
                }

                failures = progressed ? 0 : failures + 1;
                if (failures > maxReconnects) {
                    pub.closeExceptionally(new IOException("stream " + request.key() + " gave up after "
                            + maxReconnects + " reconnect attempts"));
                    return;
                }
                Thread.sleep(reconnectDelay.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (link.released) {
                log.debug("Stream cancelled: url={}", url);
                return;
            }
            pub.closeExceptionally(e);
        } catch (Exception e) {
            pub.closeExceptionally(e);
        }
    }

    private static boolean active(SubmissionPublisher<StreamEvent> pub) {
        if (pub.isClosed()) return false;
        if (!pub.hasSubscribers()) {
            pub.close();
            return false;
        }
        return true;
    }

    private static void closeQuietly(InputStream body) {
        if (body == null) return;
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Failed to close response body", e);
        }
    }

    /**
     * The loop thread and the body it is reading, so a cancel from another thread can release them.
     */
    private static final class Link {
        volatile Thread thread;
        volatile InputStream body;
        volatile boolean released;

        void release() {
            released = true;
            closeQuietly(body);
            // a blocked read on the JDK body is only woken by an interrupt
            thread.interrupt();
        }
    }

    private static final class ReleasingSubscriber implements Flow.Subscriber<StreamEvent> {
        private final Flow.Subscriber<? super StreamEvent> delegate;
        private final Link link;

        ReleasingSubscriber(Flow.Subscriber<? super StreamEvent> delegate, Link link) {
            this.delegate = delegate;
            this.link = link;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            delegate.onSubscribe(new Flow.Subscription() {
                @Override
                public void request(long n) {
                    subscription.request(n);
                }

                @Override
                public void cancel() {
                    subscription.cancel();
                    link.release();
                }
            });
        }

        @Override
        public void onNext(StreamEvent item) {
            delegate.onNext(item);
        }

        @Override
        public void onError(Throwable throwable) {
            delegate.onError(throwable);
        }

        @Override
        public void onComplete() {
            delegate.onComplete();
        }
    }
}
