package com.exampack.core.spi;

import com.exampack.api.manifest.PackManifest;
import com.exampack.core.security.VerificationResult;

/**
 * 内容包完整性校验 SPI
 * <p>
 * 网络收到的字节成为已安装内容之前的唯一关卡，任何安装路径都不得绕过。
 */
public interface PackIntegrityVerifier {

    /**
     * 校验摘要与签名
     *
     * @param packData     归档文件的原始字节
     * @param manifest     随包分发的清单
     * @param publicKeyHex 该内容包固定的公钥，为 null 时使用受信任的默认公钥
     */
    VerificationResult verifyPackIntegrity(byte[] packData, PackManifest manifest, String publicKeyHex);

    default VerificationResult verifyPackIntegrity(byte[] packData, PackManifest manifest) {
        return verifyPackIntegrity(packData, manifest, null);
    }

    /**
     * 安装后篡改检测：重新计算摘要并与安装时记录的摘要比对
     */
    VerificationResult detectTampering(String expectedChecksum, byte[] currentPackData);
}
