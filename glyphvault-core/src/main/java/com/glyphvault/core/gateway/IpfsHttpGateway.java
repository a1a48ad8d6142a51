package com.glyphvault.core.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link ContentGateway} over the HTTP RPC API of an IPFS node.
 *
 * Uploads go to {@code /api/v0/add} and are pinned. Downloads use
 * {@code /api/v0/cat} and fall back to a public read-only gateway
 * ({@code GET /ipfs/<cid>}) when one is configured and the node fails.
 */
public class IpfsHttpGateway implements ContentGateway {

    private static final Logger log = LoggerFactory.getLogger(IpfsHttpGateway.class);

    private static final TypeReference<Map<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

    private final String apiUrl;
    private final String gatewayUrl;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private IpfsHttpGateway(Builder builder) {
        this.apiUrl = stripTrailingSlash(builder.apiUrl);
        this.gatewayUrl = builder.gatewayUrl != null ? stripTrailingSlash(builder.gatewayUrl) : null;
        this.requestTimeout = builder.requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(builder.connectTimeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String upload(Map<String, Object> data) {
        Objects.requireNonNull(data, "Data cannot be null");
        String boundary = "glyphvault-" + UUID.randomUUID();
        byte[] body;
        try {
            body = multipart(boundary, objectMapper.writeValueAsBytes(data));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable", e);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + "/api/v0/add?pin=true"))
                .timeout(requestTimeout)
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();

        String responseBody = send(request, "upload");
        try {
            JsonNode hash = objectMapper.readTree(responseBody).get("Hash");
            if (hash == null || hash.asText().isBlank()) {
                throw new GatewayException("Upload response carries no content identifier", 200);
            }
            log.info("Uploaded payload to IPFS as {}", hash.asText());
            return hash.asText();
        } catch (JsonProcessingException e) {
            throw new GatewayException("Upload response is not JSON", e);
        }
    }

    @Override
    public Map<String, Object> download(String cid) {
        if (cid == null || cid.isBlank()) {
            throw new IllegalArgumentException("CID cannot be null or blank");
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiUrl + "/api/v0/cat?arg=" + URLEncoder.encode(cid, StandardCharsets.UTF_8)))
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        try {
            return parsePayload(send(request, "cat " + cid));
        } catch (GatewayException e) {
            if (gatewayUrl == null) {
                throw e;
            }
            log.warn("IPFS node failed to serve {}, trying public gateway: {}", cid, e.getMessage());
        }
        HttpRequest fallback = HttpRequest.newBuilder()
                .uri(URI.create(gatewayUrl + "/ipfs/" + URLEncoder.encode(cid, StandardCharsets.UTF_8)))
                .timeout(requestTimeout)
                .GET()
                .build();
        return parsePayload(send(fallback, "gateway fetch " + cid));
    }

    // ==================== HTTP Methods ====================

    private String send(HttpRequest request, String operation) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new GatewayException("IPFS " + operation + " failed with HTTP " + response.statusCode(),
                        response.statusCode());
            }
            return response.body();
        } catch (IOException e) {
            throw new GatewayException("IPFS " + operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException("IPFS " + operation + " was interrupted", e);
        }
    }

    private Map<String, Object> parsePayload(String body) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node != null && node.isObject()) {
                return objectMapper.convertValue(node, OBJECT_TYPE);
            }
        } catch (JsonProcessingException e) {
            log.debug("Payload is not JSON, keeping it as raw text");
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("raw", body);
        return raw;
    }

    private static byte[] multipart(String boundary, byte[] json) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"data.json\"\r\n"
                + "Content-Type: application/json\r\n\r\n";
        out.writeBytes(head.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(json);
        out.writeBytes(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // ==================== Builder ====================

    public static class Builder {
        private String apiUrl = "http://127.0.0.1:5001";
        private String gatewayUrl;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        public Builder apiUrl(String apiUrl) {
            this.apiUrl = apiUrl;
            return this;
        }

        /**
         * Read-only fallback for downloads, e.g. {@code https://ipfs.io}.
         */
        public Builder gatewayUrl(String gatewayUrl) {
            this.gatewayUrl = gatewayUrl;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public IpfsHttpGateway build() {
            if (apiUrl == null || apiUrl.isBlank()) {
                throw new IllegalArgumentException("IPFS API URL is required");
            }
            Objects.requireNonNull(connectTimeout, "Connect timeout cannot be null");
            Objects.requireNonNull(requestTimeout, "Request timeout cannot be null");
            return new IpfsHttpGateway(this);
        }
    }
}
