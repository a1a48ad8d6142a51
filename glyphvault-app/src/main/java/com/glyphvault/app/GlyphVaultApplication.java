package com.glyphvault.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Glyph Vault
 *
 * Encrypted, signed provenance records with Merkle anchoring on an EVM chain.
 */
@SpringBootApplication
public class GlyphVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlyphVaultApplication.class, args);
    }
}
