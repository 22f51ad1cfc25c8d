package com.beancount.langserver.loader.reference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/** Detects GPG-encrypted ledgers, which only the reference engine can read. */
public final class EncryptedLedgers {
    private static final String ARMOR_HEADER = "-----BEGIN PGP MESSAGE-----";
    private static final int ARMOR_SCAN_BYTES = 1024;

    private EncryptedLedgers() {}

    public static boolean isEncrypted(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".gpg")) {
            return true;
        }
        if (!lower.endsWith(".asc")) {
            return false;
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] head = in.readNBytes(ARMOR_SCAN_BYTES);
            return new String(head, StandardCharsets.US_ASCII).contains(ARMOR_HEADER);
        } catch (IOException ex) {
            return false;
        }
    }
}
