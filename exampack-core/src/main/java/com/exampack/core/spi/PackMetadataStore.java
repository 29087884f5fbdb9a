package com.exampack.core.spi;

import com.exampack.core.store.PackMetadataRecord;

import java.io.IOException;
import java.util.Optional;

/**
 * 内容包安全元数据存储 SPI
 * <p>
 * 每个 packId 一条记录，外加可选的固定公钥。
 */
public interface PackMetadataStore {

    void save(String packId, PackMetadataRecord record) throws IOException;

    Optional<PackMetadataRecord> find(String packId);

    /**
     * 为某内容包固定公钥，校验签名时优先于全局受信任公钥
     */
    void pinPublicKey(String packId, String publicKeyHex) throws IOException;

    Optional<String> findPublicKey(String packId);

    /**
     * 删除记录与固定公钥，不存在时视为成功
     */
    void remove(String packId) throws IOException;
}
