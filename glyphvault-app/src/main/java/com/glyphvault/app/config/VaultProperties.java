package com.glyphvault.app.config;

import com.glyphvault.core.vault.EncryptedVaultStore;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the local vault, bound from {@code glyphvault.vault.*}.
 */
@ConfigurationProperties(prefix = "glyphvault.vault")
public class VaultProperties {

    private String storagePath = "./glyph_vault";
    private String passphrase;
    private int kdfIterations = EncryptedVaultStore.DEFAULT_KDF_ITERATIONS;
    private String signingKey;
    private boolean serverAttestation = false;
    private final Ipfs ipfs = new Ipfs();

    public String getStoragePath() { return storagePath; }
    public void setStoragePath(String storagePath) { this.storagePath = storagePath; }
    public String getPassphrase() { return passphrase; }
    public void setPassphrase(String passphrase) { this.passphrase = passphrase; }
    public int getKdfIterations() { return kdfIterations; }
    public void setKdfIterations(int kdfIterations) { this.kdfIterations = kdfIterations; }
    public String getSigningKey() { return signingKey; }
    public void setSigningKey(String signingKey) { this.signingKey = signingKey; }
    public boolean isServerAttestation() { return serverAttestation; }
    public void setServerAttestation(boolean serverAttestation) { this.serverAttestation = serverAttestation; }
    public Ipfs getIpfs() { return ipfs; }

    /**
     * Content gateway; disabled unless {@code api-url} is set.
     */
    public static class Ipfs {
        private String apiUrl;
        private String gatewayUrl;
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getGatewayUrl() { return gatewayUrl; }
        public void setGatewayUrl(String gatewayUrl) { this.gatewayUrl = gatewayUrl; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }
}
