package com.deepansh.gateway.transport;

import com.deepansh.gateway.provider.ProviderRequest;

/**
 * The HTTP boundary. Implementations map failures onto the error taxonomy:
 * connection problems, 429 and 5xx become {@code TransportException};
 * any other non-2xx status becomes {@code ProviderProtocolException}.
 */
public interface ProviderTransport {

    /** Sends the request and returns the whole response body. */
    byte[] send(ProviderRequest request);

    /**
     * Sends the request and returns the open response body once the status is
     * known to be successful. The caller must close it.
     */
    ProviderStream openStream(ProviderRequest request);
}
