package com.deepansh.gateway.streaming;

import com.deepansh.gateway.model.ResponseChunk;

import java.util.List;

/**
 * Incremental, per-response parser from provider bytes to canonical chunks.
 * Not thread-safe and not reusable: one instance per provider call.
 */
public interface StreamingParser {

    /** Consumes the next block of bytes and returns whatever chunks it completed. */
    List<ResponseChunk> feed(byte[] bytes, int offset, int length);

    /**
     * Signals end of input. When no terminal chunk was produced yet, the result
     * ends with a synthetic {@code error} chunk.
     */
    List<ResponseChunk> finish();

    /** True once a chunk with a finish reason has been produced. */
    boolean isTerminated();
}
