package com.glyphvault.blockchain.service;

import java.time.Instant;

/**
 * On-chain state of a root. {@code timestamp} is null when not anchored.
 */
public record AnchorStatus(String root, boolean anchored, Instant timestamp) {}
