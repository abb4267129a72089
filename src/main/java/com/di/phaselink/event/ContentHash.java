package com.di.phaselink.event;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.TreeSet;

/** SHA-256 fingerprints for stage outputs. Order of the input rows does not matter. */
public final class ContentHash {

    private ContentHash() {
    }

    public static String of(Collection<String> rows) {
        MessageDigest digest = sha256();
        for (String row : new TreeSet<>(rows)) {
            digest.update(row.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String of(String... parts) {
        MessageDigest digest = sha256();
        for (String p : parts) {
            digest.update(String.valueOf(p).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
