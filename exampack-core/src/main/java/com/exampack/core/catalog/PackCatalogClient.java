package com.exampack.core.catalog;

import com.exampack.api.catalog.AvailablePack;
import com.exampack.api.exception.InvalidArgumentException;
import com.exampack.api.exception.PackDownloadException;
import com.exampack.api.exception.PackDownloadException.Reason;
import com.exampack.api.install.CompatibilityResult;
import com.exampack.api.manifest.PackManifest;
import com.exampack.core.config.PackFrameConfig;
import com.exampack.core.spi.PackTransport;
import com.exampack.core.spi.PackTransport.TransportResponse;
import com.exampack.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * 分发服务器目录客户端
 * <p>
 * 接口：
 * <pre>
 * GET {base}/packs
 * GET {base}/packs/{id}/manifest.json
 * GET {base}/packs/{id}/compatibility?appVersion=x.y.z
 * </pre>
 */
@Slf4j
public class PackCatalogClient {

    private static final TypeReference<List<AvailablePack>> PACK_LIST = new TypeReference<List<AvailablePack>>() {
    };

    private final String baseUrl;
    private final Duration timeout;
    private final PackTransport transport;

    public PackCatalogClient(PackFrameConfig config, PackTransport transport) {
        this(config.getCatalogBaseUrl(), config.catalogTimeout(), transport);
    }

    public PackCatalogClient(String baseUrl, Duration timeout, PackTransport transport) {
        if (baseUrl == null || baseUrl.trim().isEmpty()) {
            throw new InvalidArgumentException("catalogBaseUrl", "Catalog base URL cannot be empty");
        }
        String trimmed = baseUrl.trim();
        this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        this.timeout = timeout;
        this.transport = transport;
    }

    public List<AvailablePack> listAvailablePacks() {
        byte[] body = get(null, "/packs");
        try {
            List<AvailablePack> packs = JsonUtils.mapper().readValue(body, PACK_LIST);
            log.debug("Catalog lists {} pack(s)", packs.size());
            return packs;
        } catch (IOException e) {
            throw new InvalidArgumentException("catalog", "Malformed pack list: " + e.getMessage(), e);
        }
    }

    public PackManifest fetchManifest(String packId) {
        requireNotBlank("packId", packId);
        byte[] body = get(packId, "/packs/" + encode(packId) + "/manifest.json");
        try {
            return JsonUtils.mapper().readValue(body, PackManifest.class);
        } catch (IOException e) {
            throw new InvalidArgumentException("manifest", "Malformed manifest for " + packId + ": " + e.getMessage(), e);
        }
    }

    /**
     * 服务端兼容性查询，响应形如 {@code {"compatible": false, "minVersion": "2.0.0"}}
     */
    public CompatibilityResult checkRemoteCompatibility(String packId, String appVersion) {
        requireNotBlank("packId", packId);
        requireNotBlank("appVersion", appVersion);
        byte[] body = get(packId, "/packs/" + encode(packId) + "/compatibility?appVersion=" + encode(appVersion));
        JsonNode node;
        try {
            node = JsonUtils.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidArgumentException("compatibility", "Malformed compatibility response: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new InvalidArgumentException("compatibility", "Unreadable compatibility response", e);
        }
        if (node == null || !node.path("compatible").isBoolean()) {
            throw new InvalidArgumentException("compatibility", "Compatibility response has no 'compatible' flag");
        }
        if (node.get("compatible").booleanValue()) {
            return CompatibilityResult.compatible();
        }
        String minVersion = node.path("minVersion").asText(null);
        return CompatibilityResult.incompatible(minVersion != null
                ? String.format("App version %s is below minimum required %s", appVersion, minVersion)
                : "Pack " + packId + " is not compatible with app version " + appVersion);
    }

    private byte[] get(String packId, String path) {
        URI uri = URI.create(baseUrl + path);
        try (TransportResponse response = transport.open(uri, timeout);
                InputStream in = response.getInputStream()) {
            return in.readAllBytes();
        } catch (SocketTimeoutException e) {
            throw new PackDownloadException(packId, Reason.TIMEOUT, "Catalog request timed out: " + uri, e);
        } catch (IOException e) {
            throw new PackDownloadException(packId, Reason.NETWORK, "Catalog request failed: " + e.getMessage(), e);
        }
    }

    private static void requireNotBlank(String field, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidArgumentException(field, field + " cannot be empty");
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
