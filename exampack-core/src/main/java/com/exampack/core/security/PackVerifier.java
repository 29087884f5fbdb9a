package com.exampack.core.security;

import com.exampack.api.manifest.PackManifest;
import com.exampack.core.config.PackFrameConfig;
import com.exampack.core.spi.PackIntegrityVerifier;
import lombok.extern.slf4j.Slf4j;

import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * 内容包完整性验证器
 * <p>
 * 摘要：归档字节的 SHA-256；签名：受信任公钥对 {@link SignaturePayload} 的 Ed25519 签名。
 * 两者都必须通过，任一失败即整体失败。
 */
@Slf4j
public class PackVerifier implements PackIntegrityVerifier {

    private static final HexFormat HEX = HexFormat.of();
    private static final int MIN_EXPECTED_ARCHIVE_SIZE = 1000;

    private final String trustedPublicKey;
    private final Duration maxPackAge;
    private final Clock clock;

    public PackVerifier(String trustedPublicKey) {
        this(trustedPublicKey, Duration.ofDays(365), Clock.systemUTC());
    }

    public PackVerifier(String trustedPublicKey, Duration maxPackAge, Clock clock) {
        this.trustedPublicKey = trustedPublicKey;
        this.maxPackAge = maxPackAge;
        this.clock = clock;
    }

    public static PackVerifier fromConfig(PackFrameConfig config) {
        return new PackVerifier(config.getTrustedPublicKey(), config.packMaxAge(), Clock.systemUTC());
    }

    /**
     * 计算 SHA-256（小写十六进制）
     */
    public static String sha256Hex(byte[] data) {
        try {
            return HEX.formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            // 每个 JDK 实现都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public ChecksumResult verifyChecksum(byte[] packData, String expectedChecksum) {
        String computed = sha256Hex(packData);
        boolean valid = expectedChecksum != null
                && computed.equals(expectedChecksum.toLowerCase(Locale.ROOT));
        return new ChecksumResult(valid, computed);
    }

    /**
     * 校验清单签名
     *
     * @param publicKeyHex 为 null 时使用受信任的默认公钥
     */
    public VerificationResult verifySignature(PackManifest manifest, String publicKeyHex) {
        String keyToUse = publicKeyHex != null ? publicKeyHex : trustedPublicKey;
        if (keyToUse == null || keyToUse.isEmpty()) {
            return VerificationResult.failure("No public key available for signature verification");
        }
        if (!Ed25519Keys.isValidKeyHex(keyToUse)) {
            return VerificationResult.failure("Invalid public key format - must be 64 character hex string");
        }
        String signature = manifest.getSignature();
        if (signature == null || signature.isEmpty() || signature.length() % 2 != 0
                || !signature.chars().allMatch(HexFormat::isHexDigit)) {
            return VerificationResult.failure("Invalid signature format - must be hexadecimal");
        }

        try {
            Signature verifier = Signature.getInstance(Ed25519Keys.ALGORITHM);
            verifier.initVerify(Ed25519Keys.publicKeyFromHex(keyToUse));
            verifier.update(SignaturePayload.of(manifest));
            if (!verifier.verify(HEX.parseHex(signature))) {
                return VerificationResult.failure("Signature verification failed - pack may be tampered with");
            }
            return VerificationResult.of(new ArrayList<>(), new ArrayList<>());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("[{}] Signature check raised: {}", manifest.getId(), e.getMessage());
            return VerificationResult.failure("Signature verification failed: " + e.getMessage());
        }
    }

    @Override
    public VerificationResult verifyPackIntegrity(byte[] packData, PackManifest manifest, String publicKeyHex) {
        if (manifest == null) {
            return VerificationResult.failure("Pack manifest is missing");
        }
        if (packData == null) {
            return VerificationResult.failure("Pack data is missing");
        }
        String packId = manifest.getId();
        log.info("[{}] Verifying pack integrity ({} bytes)...", packId, packData.length);

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        ChecksumResult checksum = verifyChecksum(packData, manifest.getChecksum());
        if (!checksum.isValid()) {
            errors.add(String.format("Checksum mismatch. Expected: %s, Got: %s",
                    manifest.getChecksum(), checksum.getComputedHash()));
        }

        VerificationResult signature = verifySignature(manifest, publicKeyHex);
        errors.addAll(signature.getErrors());
        warnings.addAll(signature.getWarnings());

        if (isBlank(manifest.getId()) || isBlank(manifest.getVersion())) {
            errors.add("Pack manifest missing required identification fields");
        }
        Long createdAt = manifest.getCreatedAt();
        if (createdAt == null || createdAt <= 0) {
            errors.add("Pack manifest missing or invalid creation timestamp");
        } else if (clock.millis() - createdAt > maxPackAge.toMillis()) {
            warnings.add("Pack is more than " + maxPackAge.toDays() + " days old - consider updating");
        }

        VerificationResult result = VerificationResult.of(errors, warnings);
        if (result.isValid()) {
            log.info("[{}] Integrity check passed", packId);
        } else {
            log.warn("[{}] Integrity check failed: {}", packId, errors);
        }
        return result;
    }

    @Override
    public VerificationResult detectTampering(String expectedChecksum, byte[] currentPackData) {
        List<String> errors = new ArrayList<>();
        ChecksumResult checksum = verifyChecksum(currentPackData, expectedChecksum);
        if (!checksum.isValid()) {
            errors.add("Pack data has been modified since installation");
            if (currentPackData.length == 0) {
                errors.add("Pack file is empty or corrupted");
            } else if (currentPackData.length < MIN_EXPECTED_ARCHIVE_SIZE) {
                errors.add("Pack file is unusually small - may be truncated");
            }
        }
        return VerificationResult.of(errors, new ArrayList<>());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
