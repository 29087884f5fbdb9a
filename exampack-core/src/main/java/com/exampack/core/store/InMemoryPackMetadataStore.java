package com.exampack.core.store;

import com.exampack.core.spi.PackMetadataStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPackMetadataStore implements PackMetadataStore {

    private final Map<String, PackMetadataRecord> records = new ConcurrentHashMap<>();
    private final Map<String, String> keys = new ConcurrentHashMap<>();

    @Override
    public void save(String packId, PackMetadataRecord record) {
        records.put(packId, record);
    }

    @Override
    public Optional<PackMetadataRecord> find(String packId) {
        return Optional.ofNullable(records.get(packId));
    }

    @Override
    public void pinPublicKey(String packId, String publicKeyHex) {
        keys.put(packId, publicKeyHex);
    }

    @Override
    public Optional<String> findPublicKey(String packId) {
        return Optional.ofNullable(keys.get(packId));
    }

    @Override
    public void remove(String packId) {
        records.remove(packId);
        keys.remove(packId);
    }
}
