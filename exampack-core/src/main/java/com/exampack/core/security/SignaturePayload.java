package com.exampack.core.security;

import com.exampack.api.manifest.PackManifest;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 签名原文
 * <p>
 * 由清单的身份与完整性字段按固定顺序以换行拼接：
 * id, version, checksum(小写), minAppVersion, maxAppVersion(缺省为空串), createdAt。
 * 发布端与校验端必须使用同一份实现。
 */
public final class SignaturePayload {

    private SignaturePayload() {
    }

    public static byte[] of(PackManifest manifest) {
        String checksum = manifest.getChecksum() != null ? manifest.getChecksum().toLowerCase(Locale.ROOT) : "";
        String payload = String.join("\n",
                nullToEmpty(manifest.getId()),
                nullToEmpty(manifest.getVersion()),
                checksum,
                nullToEmpty(manifest.getMinAppVersion()),
                nullToEmpty(manifest.getMaxAppVersion()),
                manifest.getCreatedAt() != null ? Long.toString(manifest.getCreatedAt()) : "");
        return payload.getBytes(StandardCharsets.UTF_8);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
