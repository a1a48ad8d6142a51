package com.glyphvault.app.config;

import com.glyphvault.app.service.AnchorBatchService;
import com.glyphvault.blockchain.service.ChainAnchorClient;
import com.glyphvault.blockchain.service.ChainAnchorConfig;
import com.glyphvault.core.GlyphVault;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chain anchoring, present only with {@code glyphvault.chain.enabled=true}.
 */
@Configuration
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "glyphvault.chain", name = "enabled", havingValue = "true")
public class ChainConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "glyphvault.chain")
    public ChainAnchorConfig chainAnchorConfig() {
        return new ChainAnchorConfig();
    }

    @Bean(destroyMethod = "close")
    public ChainAnchorClient chainAnchorClient(ChainAnchorConfig chainAnchorConfig) {
        return ChainAnchorClient.connect(chainAnchorConfig);
    }

    @Bean
    public AnchorBatchService anchorBatchService(GlyphVault glyphVault, ChainAnchorClient chainAnchorClient) {
        return new AnchorBatchService(glyphVault, chainAnchorClient);
    }
}
