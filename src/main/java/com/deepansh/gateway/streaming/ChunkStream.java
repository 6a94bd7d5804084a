package com.deepansh.gateway.streaming;

import com.deepansh.gateway.exception.TransportException;
import com.deepansh.gateway.model.ResponseChunk;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy, finite, non-restartable sequence of chunks for one provider call.
 *
 * Bytes are pulled from the upstream body only when the consumer asks for
 * the next chunk. The sequence ends right after its terminal chunk, and the
 * upstream body is closed at that point, on {@link #close()}, or when reading
 * fails.
 */
@Slf4j
public class ChunkStream implements Iterator<ResponseChunk>, AutoCloseable {

    private static final int BLOCK_SIZE = 8192;

    private final InputStream body;
    private final StreamingParser parser;
    private final Deque<ResponseChunk> pending = new ArrayDeque<>();
    private final byte[] buffer;

    private boolean inputDone;
    private boolean terminalDelivered;
    private boolean closed;

    private ChunkStream(InputStream body, StreamingParser parser) {
        this.body = body;
        this.parser = parser;
        this.buffer = body == null ? new byte[0] : new byte[BLOCK_SIZE];
        this.inputDone = body == null;
    }

    public static ChunkStream reading(InputStream body, StreamingParser parser) {
        return new ChunkStream(body, parser);
    }

    /** A stream over chunks that are already known, e.g. from a buffered response. */
    public static ChunkStream of(List<ResponseChunk> chunks) {
        ChunkStream stream = new ChunkStream(null, null);
        stream.pending.addAll(chunks);
        return stream;
    }

    @Override
    public boolean hasNext() {
        if (terminalDelivered || closed) {
            return false;
        }
        fill();
        return !pending.isEmpty();
    }

    @Override
    public ResponseChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Chunk stream is exhausted");
        }
        ResponseChunk chunk = pending.poll();
        if (chunk.isTerminal()) {
            terminalDelivered = true;
            close();
        }
        return chunk;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (body != null) {
            try {
                body.close();
            } catch (IOException e) {
                log.debug("Ignoring failure while closing provider stream: {}", e.getMessage());
            }
        }
    }

    private void fill() {
        while (pending.isEmpty() && !inputDone) {
            int read;
            try {
                read = body.read(buffer);
            } catch (IOException e) {
                inputDone = true;
                if (closed) {
                    return;
                }
                log.warn("Provider stream read failed: {}", e.getMessage());
                pending.add(ResponseChunk.failed(new TransportException("Provider stream read failed", e)));
                return;
            }
            if (read < 0) {
                inputDone = true;
                pending.addAll(parser.finish());
            } else if (read > 0) {
                pending.addAll(parser.feed(buffer, 0, read));
                if (parser.isTerminated()) {
                    inputDone = true;
                }
            }
        }
    }
}
