package com.glyphvault.core.gateway;

import com.glyphvault.core.error.GlyphVaultException;

/**
 * The storage network could not be reached or answered with an error.
 */
public class GatewayException extends GlyphVaultException {

    private final int statusCode;

    public GatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed call, or -1 when no response arrived.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
