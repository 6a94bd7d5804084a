package com.deepansh.gateway.streaming;

import com.deepansh.gateway.model.ResponseChunk;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/** For providers that only speak SSE: runs a fresh streaming parser over the whole body. */
public class BufferedSseParser implements NonStreamingParser {

    private final Supplier<StreamingParser> parserFactory;

    public BufferedSseParser(Supplier<StreamingParser> parserFactory) {
        this.parserFactory = parserFactory;
    }

    @Override
    public List<ResponseChunk> parse(byte[] body) {
        StreamingParser parser = parserFactory.get();
        List<ResponseChunk> out = new ArrayList<>(parser.feed(body, 0, body.length));
        out.addAll(parser.finish());
        return out;
    }
}
