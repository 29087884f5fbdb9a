package com.exampack.api.install;

import lombok.Value;

@Value
public class PackStorageInfo {
    String id;
    long size;
    String version;
}
