package net.unishelf.util;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * Time-ordered identifiers for new rows.
 */
public final class IdGenerator {

    // Single SecureRandom instance; thread-safe for concurrent use
    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {}

    /** Time-ordered epoch UUID v7 */
    public static UUID uuidV7() {
        long ts = System.currentTimeMillis() & 0xFFFFFFFFFFFFL; // 48-bit millis
        int randA = RANDOM.nextInt(1 << 12) & 0x0FFF;            // 12-bit random

        long msb = (ts << 16) | (0x7L << 12) | randA;           // 48 ts | ver=7 | randA

        long randB = RANDOM.nextLong();
        long lsb = (randB & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L; // variant 10 + 62-bit rand

        return new UUID(msb, lsb);
    }
}
