package com.deepansh.gateway.streaming;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Push-style decoder from raw bytes to {@link SseEvent}s.
 *
 * Bytes are decoded as UTF-8 with a stateful decoder, so a multi-byte
 * character split across two reads decodes correctly. Only the incomplete
 * trailing line is buffered. An event is dispatched on a blank line; an event
 * that carries no {@code data:} line is dropped, as the SSE rules require.
 */
public class SseLineDecoder {

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);

    /** Undecoded bytes of a character split across reads. */
    private ByteBuffer carry = ByteBuffer.allocate(0);
    private final StringBuilder line = new StringBuilder();
    private boolean lastWasCr;

    private String eventName;
    private StringBuilder data;
    private String lastEventId;

    public List<SseEvent> feed(byte[] bytes, int offset, int length) {
        ByteBuffer in;
        if (carry.hasRemaining()) {
            in = ByteBuffer.allocate(carry.remaining() + length);
            in.put(carry).put(bytes, offset, length).flip();
        } else {
            in = ByteBuffer.wrap(bytes, offset, length);
        }

        CharBuffer out = CharBuffer.allocate(Math.max(16, in.remaining() + 1));
        decoder.decode(in, out, false);
        carry = in.hasRemaining() ? copyRemaining(in) : ByteBuffer.allocate(0);
        out.flip();

        List<SseEvent> events = new ArrayList<>();
        while (out.hasRemaining()) {
            char c = out.get();
            if (c == '\n' && lastWasCr) {
                lastWasCr = false;
                continue;
            }
            lastWasCr = c == '\r';
            if (c == '\n' || c == '\r') {
                processLine(line.toString(), events);
                line.setLength(0);
            } else {
                line.append(c);
            }
        }
        return events;
    }

    public List<SseEvent> feed(byte[] bytes) {
        return feed(bytes, 0, bytes.length);
    }

    /**
     * End of input. A pending event whose terminating blank line never
     * arrived is still dispatched when it has data.
     */
    public List<SseEvent> finish() {
        List<SseEvent> events = new ArrayList<>();
        CharBuffer out = CharBuffer.allocate(8);
        decoder.decode(carry, out, true);
        decoder.flush(out);
        carry = ByteBuffer.allocate(0);
        out.flip();
        line.append(out);
        if (line.length() > 0) {
            processLine(line.toString(), events);
            line.setLength(0);
        }
        dispatch(events);
        return events;
    }

    private void processLine(String text, List<SseEvent> events) {
        if (text.isEmpty()) {
            dispatch(events);
            return;
        }
        if (text.charAt(0) == ':') {
            return;
        }

        int colon = text.indexOf(':');
        String field = colon < 0 ? text : text.substring(0, colon);
        String value = colon < 0 ? "" : text.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }

        switch (field) {
            case "event" -> eventName = value;
            case "data" -> {
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
            case "id" -> lastEventId = value;
            default -> {
                // retry and unknown fields carry nothing we use
            }
        }
    }

    private void dispatch(List<SseEvent> events) {
        if (data != null) {
            events.add(new SseEvent(eventName, data.toString(), lastEventId));
        }
        eventName = null;
        data = null;
    }

    private static ByteBuffer copyRemaining(ByteBuffer in) {
        ByteBuffer copy = ByteBuffer.allocate(in.remaining());
        copy.put(in).flip();
        return copy;
    }
}
