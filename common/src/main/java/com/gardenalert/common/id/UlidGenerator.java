package com.gardenalert.common.id;

import java.security.SecureRandom;
import java.time.Clock;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Generates ULIDs: 48-bit millisecond timestamp followed by 80 random bits, written as
 * 26 Crockford Base32 characters so that ids sort by creation time.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class UlidGenerator {

    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int TIME_CHARS = 10;
    private static final int RANDOM_CHARS = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    public static String generate() {
        return generate(Clock.systemUTC());
    }

    public static String generate(Clock clock) {
        var chars = new char[TIME_CHARS + RANDOM_CHARS];
        long millis = clock.millis();
        for (int i = TIME_CHARS - 1; i >= 0; i--) {
            chars[i] = ALPHABET[(int) (millis & 0x1F)];
            millis >>>= 5;
        }

        // 80 random bits consumed 5 at a time from two longs (64 + 16 bits)
        long high = RANDOM.nextLong();
        long low = RANDOM.nextInt(1 << 16);
        for (int i = TIME_CHARS + RANDOM_CHARS - 1; i >= TIME_CHARS; i--) {
            chars[i] = ALPHABET[(int) (low & 0x1F)];
            low = (low >>> 5) | ((high & 0x1F) << 11);
            high >>>= 5;
        }
        return new String(chars);
    }
}
