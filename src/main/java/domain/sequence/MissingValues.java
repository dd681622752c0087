package domain.sequence;

import java.util.Set;

/**
 * Missing-value markers of the Summary File.
 *
 * <p>"-1" is treated as missing everywhere, including the few tables where it could be a
 * real estimate.</p>
 */
public final class MissingValues {

    private static final Set<String> TOKENS = Set.of(".", "-1", "");

    private MissingValues() {
    }

    public static boolean isMissingToken(String raw) {
        return raw == null || TOKENS.contains(raw.trim());
    }

    /** {@code null} for a missing marker, the raw text otherwise. */
    public static String normalize(String raw) {
        return isMissingToken(raw) ? null : raw;
    }
}
