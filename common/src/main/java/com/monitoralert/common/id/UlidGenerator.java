package com.monitoralert.common.id;

import java.security.SecureRandom;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs (Universally Unique Lexicographically Sortable Identifiers).
 * Format: 10-char timestamp (48-bit ms since epoch) + 16-char randomness (80-bit).
 * Total: 26-char Crockford Base32 string.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ENCODING = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TIMESTAMP_CHARS = 10;
    private static final int RANDOM_CHARS = 16;

    public static String generate() {
        return generate(Instant.now());
    }

    static String generate(Instant timestamp) {
        byte[] randomness = new byte[10];
        RANDOM.nextBytes(randomness);
        return encode(timestamp.toEpochMilli(), randomness);
    }

    private static String encode(long timestamp, byte[] randomness) {
        char[] chars = new char[TIMESTAMP_CHARS + RANDOM_CHARS];

        for (int i = TIMESTAMP_CHARS - 1; i >= 0; i--) {
            chars[i] = ENCODING[(int) (timestamp & 0x1F)];
            timestamp >>>= 5;
        }

        // 80 random bits, consumed five at a time from the most significant end
        int bitBuffer = 0;
        int bitCount = 0;
        int next = TIMESTAMP_CHARS;
        for (byte b : randomness) {
            bitBuffer = (bitBuffer << 8) | (b & 0xFF);
            bitCount += 8;
            while (bitCount >= 5) {
                bitCount -= 5;
                chars[next++] = ENCODING[(bitBuffer >>> bitCount) & 0x1F];
            }
        }

        return new String(chars);
    }
}
