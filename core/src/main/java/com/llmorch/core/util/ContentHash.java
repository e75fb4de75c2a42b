package com.llmorch.core.util;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Stable content hash of an object's canonical JSON form.
 * Used to detect whether a desired child object differs from what was last written.
 */
public final class ContentHash {
    private ContentHash() {
    }

    /**
     * @return the first 16 hex characters of the SHA-256 of the canonical JSON
     */
    public static String of(Object value) {
        String canonical = JsonUtils.writeCanonical(value);
        return Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString().substring(0, 16);
    }
}
