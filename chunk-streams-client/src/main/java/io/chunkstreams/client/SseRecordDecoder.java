package io.chunkstreams.client;

import io.chunkstreams.core.Protocol;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Incremental decoder for {@code text/event-stream} bytes.
 *
 * <p>Bytes may be fed in arbitrary slices: a multi-byte character or a line split across two
 * reads is completed by the next {@link #feed}. Lines end with {@code \n}, {@code \r\n} or
 * {@code \r}. A blank line dispatches the pending {@code data:} lines as one {@link SseRecord.Data};
 * comment lines are returned as they complete. Fields other than {@code data} are ignored.
 *
 * <p>Not thread-safe; one decoder per connection.
 */
public final class SseRecordDecoder {

    private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    private ByteBuffer carry = ByteBuffer.allocate(0);
    private final CharBuffer chars = CharBuffer.allocate(8192);
    private final StringBuilder line = new StringBuilder();
    private final List<String> dataLines = new ArrayList<>();
    private boolean lastWasCr;

    public List<SseRecord> feed(byte[] bytes) {
        return feed(bytes, 0, bytes.length);
    }

    public List<SseRecord> feed(byte[] bytes, int off, int len) {
        List<SseRecord> out = new ArrayList<>();
        ByteBuffer in = prepend(ByteBuffer.wrap(bytes, off, len));
        decode(in, false, out);
        // at most three bytes of an incomplete character are left over
        carry = ByteBuffer.allocate(in.remaining()).put(in).flip();
        return out;
    }

    /**
     * Flushes the decoder at end of input. A record missing its terminating blank line is still
     * dispatched.
     */
    public List<SseRecord> finish() {
        List<SseRecord> out = new ArrayList<>();
        decode(carry, true, out);
        carry = ByteBuffer.allocate(0);
        chars.clear();
        utf8.flush(chars);
        chars.flip();
        consume(out);
        if (line.length() > 0) {
            completeLine(out);
        }
        dispatch(out);
        utf8.reset();
        lastWasCr = false;
        return out;
    }

    private ByteBuffer prepend(ByteBuffer in) {
        if (!carry.hasRemaining()) return in;
        ByteBuffer joined = ByteBuffer.allocate(carry.remaining() + in.remaining());
        joined.put(carry).put(in).flip();
        return joined;
    }

    private void decode(ByteBuffer in, boolean endOfInput, List<SseRecord> out) {
        while (true) {
            chars.clear();
            utf8.decode(in, chars, endOfInput);
            chars.flip();
            if (!chars.hasRemaining()) return;
            consume(out);
        }
    }

    private void consume(List<SseRecord> out) {
        while (chars.hasRemaining()) {
            char c = chars.get();
            if (c == '\n') {
                if (lastWasCr) {
                    lastWasCr = false;
                    continue;
                }
                completeLine(out);
            } else if (c == '\r') {
                lastWasCr = true;
                completeLine(out);
            } else {
                lastWasCr = false;
                line.append(c);
            }
        }
    }

    private void completeLine(List<SseRecord> out) {
        String text = line.toString();
        line.setLength(0);
        if (text.isEmpty()) {
            dispatch(out);
        } else if (text.startsWith(Protocol.FIELD_COMMENT)) {
            out.add(new SseRecord.Comment(valueAfter(text, Protocol.FIELD_COMMENT.length())));
        } else if (text.startsWith(Protocol.FIELD_DATA)) {
            dataLines.add(valueAfter(text, Protocol.FIELD_DATA.length()));
        } else if (text.equals("data")) {
            dataLines.add("");
        }
    }

    private void dispatch(List<SseRecord> out) {
        if (dataLines.isEmpty()) return;
        out.add(new SseRecord.Data(dataLines));
        dataLines.clear();
    }

    private static String valueAfter(String text, int prefix) {
        int start = prefix < text.length() && text.charAt(prefix) == ' ' ? prefix + 1 : prefix;
        return text.substring(start);
    }
}
