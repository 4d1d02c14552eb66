package io.github.drompincen.agentchat.protocol.wire;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits a UTF-8 byte stream into newline-terminated records. A multi-byte character
 * cut across two reads is held back until its remaining bytes arrive, and the
 * unterminated tail is kept for the next {@link #feed} or returned by {@link #flush}.
 * Not thread-safe; one framer per stream.
 */
public class LineFramer {

    private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private final StringBuilder buffer = new StringBuilder();
    private ByteBuffer undecoded = EMPTY;

    public List<String> feed(byte[] chunk) {
        return feed(chunk, 0, chunk.length);
    }

    public List<String> feed(byte[] chunk, int offset, int length) {
        ByteBuffer in = ByteBuffer.allocate(undecoded.remaining() + length);
        in.put(undecoded);
        in.put(chunk, offset, length);
        in.flip();
        CharBuffer out = CharBuffer.allocate(in.remaining());
        decoder.decode(in, out, false);
        out.flip();
        buffer.append(out);
        undecoded = in.hasRemaining() ? in.slice() : EMPTY;
        return drainLines();
    }

    public List<String> feed(String text) {
        buffer.append(text);
        return drainLines();
    }

    /**
     * Returns the unterminated fragment at end of stream, if it holds anything but whitespace.
     */
    public Optional<String> flush() {
        CharBuffer out = CharBuffer.allocate(undecoded.remaining() + 1);
        decoder.decode(undecoded, out, true);
        decoder.flush(out);
        out.flip();
        buffer.append(out);
        undecoded = EMPTY;
        decoder.reset();

        String rest = stripCarriageReturn(buffer.toString());
        buffer.setLength(0);
        return rest.isBlank() ? Optional.empty() : Optional.of(rest);
    }

    public int pendingLength() {
        return buffer.length() + undecoded.remaining();
    }

    private List<String> drainLines() {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int newline;
        while ((newline = buffer.indexOf("\n", start)) >= 0) {
            String line = stripCarriageReturn(buffer.substring(start, newline));
            if (!line.isBlank()) {
                lines.add(line);
            }
            start = newline + 1;
        }
        buffer.delete(0, start);
        return lines;
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
