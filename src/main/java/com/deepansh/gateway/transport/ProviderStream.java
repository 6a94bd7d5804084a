package com.deepansh.gateway.transport;

import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/** An open response body that also releases its underlying HTTP response on close. */
public class ProviderStream extends FilterInputStream {

    private final Closeable response;

    public ProviderStream(InputStream body, Closeable response) {
        super(body);
        this.response = response;
    }

    @Override
    public void close() throws IOException {
        try {
            super.close();
        } finally {
            response.close();
        }
    }
}
