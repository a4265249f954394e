package io.chunkstreams.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SseFrameTest {

    @Test
    void rendersDataRecord() {
        assertThat(new SseFrame.Data("{\"type\":\"x\"}").render()).isEqualTo("data: {\"type\":\"x\"}\n\n");
    }

    @Test
    void rendersEachLineWithItsOwnPrefix() {
        assertThat(new SseFrame.Data("a\nb").render()).isEqualTo("data: a\ndata: b\n\n");
        assertThat(SseFrame.comment("one\r\ntwo").render()).isEqualTo(": one\n: two\n\n");
    }

    @Test
    void rendersKeepAliveAndDone() {
        assertThat(SseFrame.keepAlive().render()).isEqualTo(": keep-alive\n\n");
        assertThat(SseFrame.done().render()).isEqualTo("data: [DONE]\n\n");
    }
}
