package com.exampack.core.security;

import com.exampack.api.manifest.PackManifest;
import com.exampack.core.exception.PackSecurityException;
import com.exampack.core.support.TestPacks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PackSigner 单元测试")
public class PackSignerTest {

    @Test
    @DisplayName("生成的密钥为 64 位十六进制")
    void keyFormat() {
        PackSigner.KeyPairHex keys = PackSigner.generateKeyPair();

        assertTrue(Ed25519Keys.isValidKeyHex(keys.getPublicKey()));
        assertTrue(Ed25519Keys.isValidKeyHex(keys.getPrivateKey()));
        assertNotEquals(keys.getPublicKey(), keys.getPrivateKey());
    }

    @Test
    @DisplayName("seal 写入摘要并对包含摘要的清单签名")
    void sealSetsChecksumThenSignature() {
        PackSigner.KeyPairHex keys = PackSigner.generateKeyPair();
        byte[] archive = TestPacks.zip(TestPacks.validContent());

        PackManifest sealed = new PackSigner(keys.getPrivateKey()).seal(TestPacks.manifest("p", "1.0.0"), archive);

        assertEquals(PackVerifier.sha256Hex(archive), sealed.getChecksum());
        assertEquals(128, sealed.getSignature().length());
        assertTrue(new PackVerifier(keys.getPublicKey()).verifySignature(sealed, null).isValid());
    }

    @Test
    @DisplayName("Ed25519 签名是确定性的")
    void deterministic() {
        PackSigner signer = new PackSigner(PackSigner.generateKeyPair().getPrivateKey());
        PackManifest manifest = TestPacks.manifest("p", "1.0.0").toBuilder().checksum("0".repeat(64)).build();

        assertEquals(signer.sign(manifest), signer.sign(manifest));
    }

    @Test
    @DisplayName("非法私钥")
    void invalidKey() {
        assertThrows(PackSecurityException.class, () -> new PackSigner("not-a-key"));
    }
}
