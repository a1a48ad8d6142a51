package com.glyphvault.core.gateway;

import java.util.Map;

/**
 * Content-addressed storage network the vault can pull payloads from and
 * publish payloads to.
 */
public interface ContentGateway {

    /**
     * Stores a JSON payload and returns its content identifier.
     *
     * @throws GatewayException when the network rejects or cannot take the upload
     */
    String upload(Map<String, Object> data);

    /**
     * Fetches the payload stored under {@code cid}. Content that is not a
     * JSON object is returned as {@code {"raw": text}}.
     *
     * @throws GatewayException when the content cannot be fetched
     */
    Map<String, Object> download(String cid);
}
