package com.glyphvault.app.config;

import com.glyphvault.core.GlyphVault;
import com.glyphvault.core.error.ConfigurationException;
import com.glyphvault.core.gateway.ContentGateway;
import com.glyphvault.core.gateway.IpfsHttpGateway;
import com.glyphvault.core.glyph.GlyphFactory;
import com.glyphvault.core.glyph.SigningIdentity;
import com.glyphvault.core.ledger.AuditLedger;
import com.glyphvault.core.vault.EncryptedVaultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Assembles the vault from {@link VaultProperties}. Startup fails when the
 * passphrase is missing, or when no signing key is configured and server
 * attestation was not chosen explicitly.
 */
@Configuration
@EnableConfigurationProperties(VaultProperties.class)
public class VaultConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VaultConfiguration.class);

    static final String LEDGER_FILE = "ledger";

    @Bean
    public SigningIdentity signingIdentity(VaultProperties properties) {
        String key = properties.getSigningKey();
        if (key != null && !key.isBlank()) {
            return SigningIdentity.localKey(key);
        }
        if (!properties.isServerAttestation()) {
            throw new ConfigurationException(
                    "No signing key configured; set glyphvault.vault.signing-key or glyphvault.vault.server-attestation=true");
        }
        log.warn("No signing key configured, glyphs will carry server attestations only");
        return SigningIdentity.serverAttestation();
    }

    @Bean(destroyMethod = "close")
    public GlyphVault glyphVault(VaultProperties properties, SigningIdentity signingIdentity) {
        if (properties.getPassphrase() == null || properties.getPassphrase().isBlank()) {
            throw new ConfigurationException("glyphvault.vault.passphrase must be set");
        }
        Path storage = Path.of(properties.getStoragePath());
        EncryptedVaultStore store = EncryptedVaultStore.open(storage, properties.getPassphrase(), properties.getKdfIterations());
        Clock clock = Clock.systemUTC();
        AuditLedger ledger = AuditLedger.open(storage.resolve(LEDGER_FILE), clock);
        GlyphVault vault = new GlyphVault(store, ledger, new GlyphFactory(signingIdentity, clock),
                contentGateway(properties.getIpfs()), clock);

        int orphans = vault.recoverOrphans();
        log.info("Glyph vault ready at {} (signer {}, {} orphan blobs removed)",
                storage.toAbsolutePath(), signingIdentity.signer(), orphans);
        return vault;
    }

    private static ContentGateway contentGateway(VaultProperties.Ipfs ipfs) {
        if (ipfs.getApiUrl() == null || ipfs.getApiUrl().isBlank()) {
            return null;
        }
        return IpfsHttpGateway.builder()
                .apiUrl(ipfs.getApiUrl())
                .gatewayUrl(ipfs.getGatewayUrl())
                .requestTimeout(ipfs.getRequestTimeout())
                .build();
    }
}
