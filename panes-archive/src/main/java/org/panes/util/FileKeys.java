package org.panes.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Identity keys of the form {@code <byteSize>-<first 16 hex digits of SHA-256>}.
 * Content-derived keys survive renames; folder keys follow the directory's inode on its volume instead.
 */
@Slf4j
@UtilityClass
public class FileKeys {

    public static final int DEFAULT_SAMPLE_BYTES = 32 * 1024;
    private static final int HASH_PREFIX_LENGTH = 16;

    public static String fromBytes(byte[] data) {
        return data.length + "-" + sha256Hex(data).substring(0, HASH_PREFIX_LENGTH);
    }

    public static String fromLeadingBytes(Path file, int sampleBytes) throws IOException {
        long size = Files.size(file);
        byte[] sample;
        try (InputStream in = Files.newInputStream(file)) {
            sample = in.readNBytes(Math.max(sampleBytes, 0));
        }
        return size + "-" + sha256Hex(sample).substring(0, HASH_PREFIX_LENGTH);
    }

    public static String folderKey(Path directory) throws IOException {
        Object device = readUnixAttribute(directory, "unix:dev");
        Object inode = readUnixAttribute(directory, "unix:ino");
        if (device != null && inode != null) {
            return "dir-" + device + "-" + inode;
        }
        Object fileKey = Files.readAttributes(directory, BasicFileAttributes.class).fileKey();
        if (fileKey != null) {
            return "dir-" + sha256Hex(fileKey.toString()).substring(0, HASH_PREFIX_LENGTH);
        }
        String location = Files.getFileStore(directory).name() + ":" + directory.toRealPath();
        return "dir-" + sha256Hex(location).substring(0, HASH_PREFIX_LENGTH);
    }

    public static String sha256Hex(String input) {
        return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input);
            StringBuilder hexString = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hexString.append(String.format("%02x", b));
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not found", e);
        }
    }

    private static Object readUnixAttribute(Path path, String attribute) throws IOException {
        try {
            return Files.getAttribute(path, attribute);
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            log.trace("Attribute {} not available for {}", attribute, path);
            return null;
        }
    }
}
