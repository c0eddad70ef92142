package com.vibeforge.core.audit;

import com.vibeforge.util.Fingerprint;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Whole-code and per-line content hashes. Lines are 1-based and split on
 * {@code \n}; a trailing {@code \r} is not part of the line.
 */
public final class LineHasher {

    private LineHasher() {}

    public static String codeHash(String code) {
        return Fingerprint.sha256(code);
    }

    public static SortedMap<Integer, String> lineHashes(String code) {
        SortedMap<Integer, String> hashes = new TreeMap<>();
        String[] lines = code.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].endsWith("\r") ? lines[i].substring(0, lines[i].length() - 1) : lines[i];
            hashes.put(i + 1, Fingerprint.sha256(line));
        }
        return Collections.unmodifiableSortedMap(hashes);
    }
}
