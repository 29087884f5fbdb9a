package com.exampack.core.security;

import com.exampack.api.manifest.PackManifest;
import com.exampack.core.exception.PackSecurityException;
import lombok.Value;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.HexFormat;

/**
 * 发布端签名工具
 * <p>
 * 私钥只应出现在内容制作流程中，客户端只持有公钥。
 */
public class PackSigner {

    private final PrivateKey privateKey;

    public PackSigner(String privateKeyHex) {
        try {
            this.privateKey = Ed25519Keys.privateKeyFromHex(privateKeyHex);
        } catch (GeneralSecurityException e) {
            throw new PackSecurityException(null, "Invalid signing key: " + e.getMessage(), e);
        }
    }

    @Value
    public static class KeyPairHex {
        String publicKey;
        String privateKey;
    }

    public static KeyPairHex generateKeyPair() {
        try {
            KeyPair pair = KeyPairGenerator.getInstance(Ed25519Keys.ALGORITHM).generateKeyPair();
            return new KeyPairHex(Ed25519Keys.toRawHex(pair.getPublic()), Ed25519Keys.toRawHex(pair.getPrivate()));
        } catch (GeneralSecurityException e) {
            throw new PackSecurityException(null, "Ed25519 not available: " + e.getMessage(), e);
        }
    }

    /**
     * 对清单签名，返回十六进制签名
     */
    public String sign(PackManifest manifest) {
        try {
            Signature signer = Signature.getInstance(Ed25519Keys.ALGORITHM);
            signer.initSign(privateKey);
            signer.update(SignaturePayload.of(manifest));
            return HexFormat.of().formatHex(signer.sign());
        } catch (GeneralSecurityException e) {
            throw new PackSecurityException(manifest.getId(), "Failed to sign manifest: " + e.getMessage(), e);
        }
    }

    /**
     * 以归档字节计算摘要并签名，返回新的清单副本
     */
    public PackManifest seal(PackManifest manifest, byte[] archive) {
        PackManifest withChecksum = manifest.toBuilder()
                .checksum(PackVerifier.sha256Hex(archive))
                .build();
        return withChecksum.toBuilder()
                .signature(sign(withChecksum))
                .build();
    }
}
