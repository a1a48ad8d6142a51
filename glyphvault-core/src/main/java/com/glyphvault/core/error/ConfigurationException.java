package com.glyphvault.core.error;

/**
 * Setup is incomplete or invalid: missing passphrase, key material,
 * contract address or endpoint. The caller has to fix the configuration;
 * operations failing with this are never retried.
 */
public class ConfigurationException extends GlyphVaultException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
