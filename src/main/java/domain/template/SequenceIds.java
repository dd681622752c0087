package domain.template;

import java.util.regex.Pattern;

/**
 * Sequence number helpers. Sequence ids are 4-digit, zero-padded strings ("0002").
 */
public final class SequenceIds {

    private static final Pattern VALID = Pattern.compile("\\d{4}");

    private SequenceIds() {
    }

    /** Trim and left-pad with zeros to 4 characters; longer values are returned unchanged. */
    public static String normalize(String raw) {
        String s = raw == null ? "" : raw.trim();
        StringBuilder sb = new StringBuilder(4);
        for (int i = s.length(); i < 4; i++) sb.append('0');
        return sb.append(s).toString();
    }

    public static boolean isValid(String sequenceId) {
        return sequenceId != null && VALID.matcher(sequenceId).matches();
    }
}
