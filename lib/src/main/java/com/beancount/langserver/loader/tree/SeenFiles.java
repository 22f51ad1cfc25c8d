package com.beancount.langserver.loader.tree;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Canonical paths already read during one traversal; guards against include cycles. */
public final class SeenFiles {
    private final Set<Path> files = new LinkedHashSet<>();

    /** Returns {@code false} when the file was already seen. */
    public boolean add(Path file) {
        return files.add(canonical(file));
    }

    public int size() {
        return files.size();
    }

    public List<String> sortedNames() {
        List<String> names = new ArrayList<>();
        for (Path file : files) {
            names.add(file.toString());
        }
        names.sort(null);
        return names;
    }

    /** SHA-256 over the sorted file names with their sizes and modification times. */
    public String inputHash() {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
        for (String name : sortedNames()) {
            digest.update(name.getBytes(StandardCharsets.UTF_8));
            Path file = Path.of(name);
            try {
                digest.update(Long.toString(Files.size(file)).getBytes(StandardCharsets.UTF_8));
                digest.update(
                        Long.toString(Files.getLastModifiedTime(file).toMillis())
                                .getBytes(StandardCharsets.UTF_8));
            } catch (IOException ex) {
                // A file deleted since it was read hashes by name only.
                digest.update((byte) 0);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    static Path canonical(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        try {
            return absolute.toRealPath();
        } catch (IOException ex) {
            return absolute;
        }
    }
}
