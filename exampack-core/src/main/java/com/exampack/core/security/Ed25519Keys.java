package com.exampack.core.security;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Ed25519 原始密钥与 JDK 密钥对象之间的转换
 * <p>
 * 分发侧只传递 32 字节原始密钥的十六进制，JDK 需要 X.509 / PKCS#8 编码，这里补齐固定的 DER 前缀。
 */
public final class Ed25519Keys {

    public static final String ALGORITHM = "Ed25519";

    private static final HexFormat HEX = HexFormat.of();
    private static final byte[] X509_PREFIX = HEX.parseHex("302a300506032b6570032100");
    private static final byte[] PKCS8_PREFIX = HEX.parseHex("302e020100300506032b657004220420");
    private static final int RAW_KEY_LENGTH = 32;
    private static final Pattern RAW_KEY_HEX = Pattern.compile("^[a-fA-F0-9]{64}$");

    private Ed25519Keys() {
    }

    public static boolean isValidKeyHex(String hex) {
        return hex != null && RAW_KEY_HEX.matcher(hex).matches();
    }

    public static PublicKey publicKeyFromHex(String hex) throws GeneralSecurityException {
        if (!isValidKeyHex(hex)) {
            throw new GeneralSecurityException("Invalid public key format - must be 64 character hex string");
        }
        byte[] encoded = concat(X509_PREFIX, HEX.parseHex(hex));
        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    }

    public static PrivateKey privateKeyFromHex(String hex) throws GeneralSecurityException {
        if (!isValidKeyHex(hex)) {
            throw new GeneralSecurityException("Invalid private key format - must be 64 character hex string");
        }
        byte[] encoded = concat(PKCS8_PREFIX, HEX.parseHex(hex));
        return KeyFactory.getInstance(ALGORITHM).generatePrivate(new PKCS8EncodedKeySpec(encoded));
    }

    public static String toRawHex(PublicKey key) {
        return HEX.formatHex(stripPrefix(key.getEncoded(), X509_PREFIX));
    }

    public static String toRawHex(PrivateKey key) {
        return HEX.formatHex(stripPrefix(key.getEncoded(), PKCS8_PREFIX));
    }

    private static byte[] stripPrefix(byte[] encoded, byte[] prefix) {
        if (encoded.length != prefix.length + RAW_KEY_LENGTH
                || !Arrays.equals(Arrays.copyOf(encoded, prefix.length), prefix)) {
            throw new IllegalArgumentException("Unexpected Ed25519 key encoding (" + encoded.length + " bytes)");
        }
        return Arrays.copyOfRange(encoded, prefix.length, encoded.length);
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }
}
