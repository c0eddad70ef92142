package com.vibeforge.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers shared by the cache key, the payload names and the line hashes.
 */
public final class Fingerprint {

    public static final int SHORT_LENGTH = 10;

    private Fingerprint() {}

    public static String sha256(String s) {
        try {
            var md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    public static String shortHash(String fullHash) {
        return fullHash.length() <= SHORT_LENGTH ? fullHash : fullHash.substring(0, SHORT_LENGTH);
    }
}
