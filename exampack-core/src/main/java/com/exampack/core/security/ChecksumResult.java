package com.exampack.core.security;

import lombok.Value;

@Value
public class ChecksumResult {
    boolean valid;
    String computedHash;
}
