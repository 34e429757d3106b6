package com.decisions.scraper.cache;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.TreeSet;

/**
 * Canonical cache keys for keyword sets.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    /**
     * SHA-256 hex digest of the sorted, de-duplicated keywords, each fed to the
     * digest as its UTF-8 byte length followed by its bytes. Independent of
     * input order and repetitions; keywords containing separator-like
     * characters cannot collide with a split set.
     *
     * @param keywords normalised keywords
     * @return 64-character lowercase hex key
     */
    public static String canonicalKey(final Collection<String> keywords) {
        MessageDigest sha = sha256();
        for (String keyword : new TreeSet<>(keywords)) {
            byte[] bytes = keyword.getBytes(StandardCharsets.UTF_8);
            sha.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
            sha.update(bytes);
        }
        return HexFormat.of().formatHex(sha.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
