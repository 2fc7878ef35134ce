package com.eainde.literature.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class ContentHasher {

    private ContentHasher() {
    }

    // SHA-256 hex of the file bytes; identifies a document across runs
    public static String sha256(Path file) {
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), newDigest())) {
            DigestInputStream digestStream = (DigestInputStream) in;
            byte[] buffer = new byte[8192];
            while (digestStream.read(buffer) != -1) {
                // drain
            }
            return toHex(digestStream.getMessageDigest().digest());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to hash file " + file, e);
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] digest) {
        StringBuilder sb = new StringBuilder(digest.length * 2);
        for (byte b : digest) sb.append(String.format("%02x", b));
        return sb.toString();
    }
}
