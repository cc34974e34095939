package org.archivum.retention.utils;

import lombok.experimental.UtilityClass;

import java.security.SecureRandom;
import java.util.Locale;

/**
 * Archive identifiers: {@code ARC-<base36 epoch millis>-<8 base36 random chars>}, uppercased.
 */
@UtilityClass
public class ArchiveIds {

    private static final String PREFIX = "ARC";
    private static final int RANDOM_LENGTH = 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    public String generate(long epochMillis) {
        StringBuilder random = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            random.append(Character.forDigit(RANDOM.nextInt(36), 36));
        }
        return (PREFIX + "-" + Long.toString(epochMillis, 36) + "-" + random).toUpperCase(Locale.ROOT);
    }

    public boolean isValid(String archiveId) {
        return archiveId != null && archiveId.matches("ARC-[0-9A-Z]+-[0-9A-Z]{" + RANDOM_LENGTH + "}");
    }
}
