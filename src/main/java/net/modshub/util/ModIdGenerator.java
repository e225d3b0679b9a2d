package net.modshub.util;

import java.security.SecureRandom;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mints mod identifiers of the form {@code mod_<epochMillis>_<token>}.
 * <p>
 * No existence check is made against any store; the millisecond prefix plus a
 * 10-char base36 token keeps collisions out of reach without a coordination round-trip.
 */
public final class ModIdGenerator {
    // Lowercase base36: digits + lowercase
    private static final char[] TOKEN_ALPHABET =
            "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();
    private static final int TOKEN_SIZE = 10;
    private static final int MIN_TOKEN_SIZE = 8;
    private static final String PREFIX = "mod_";

    public static final Pattern MOD_ID_PATTERN = Pattern.compile("^mod_(\\d+)_[a-z0-9]+$");

    // Single SecureRandom instance; thread-safe for concurrent use
    private static final SecureRandom RANDOM = new SecureRandom();

    private ModIdGenerator() {}

    /** Id stamped with the current wall-clock time */
    public static String generate() {
        return generate(System.currentTimeMillis());
    }

    /** Id stamped with the given epoch millis */
    public static String generate(long epochMillis) {
        return generate(epochMillis, TOKEN_SIZE);
    }

    public static String generate(long epochMillis, int tokenSize) {
        if (epochMillis < 0) {
            throw new IllegalArgumentException("epochMillis must be >= 0");
        }
        if (tokenSize < MIN_TOKEN_SIZE) {
            throw new IllegalArgumentException("tokenSize must be >= " + MIN_TOKEN_SIZE);
        }
        return PREFIX + epochMillis + "_" + randomToken(tokenSize);
    }

    public static boolean isModId(String candidate) {
        return candidate != null && MOD_ID_PATTERN.matcher(candidate).matches();
    }

    /**
     * Reads the creation timestamp embedded in a mod id.
     *
     * @return epoch millis, or empty when the id is malformed or the number overflows
     */
    public static OptionalLong extractEpochMillis(String modId) {
        if (modId == null) {
            return OptionalLong.empty();
        }
        Matcher matcher = MOD_ID_PATTERN.matcher(modId);
        if (!matcher.matches()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static String randomToken(int size) {
        char[] token = new char[size];
        // Draw uniformly from alphabet
        for (int i = 0; i < size; i++) {
            token[i] = TOKEN_ALPHABET[RANDOM.nextInt(TOKEN_ALPHABET.length)];
        }
        return new String(token);
    }
}
