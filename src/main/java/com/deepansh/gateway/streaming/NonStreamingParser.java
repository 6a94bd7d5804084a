package com.deepansh.gateway.streaming;

import com.deepansh.gateway.model.ResponseChunk;

import java.util.List;

/** Parses one buffered response body into the same chunk shape streaming produces. */
@FunctionalInterface
public interface NonStreamingParser {

    List<ResponseChunk> parse(byte[] body);
}
