package domain.output;

import java.util.Locale;

/**
 * File naming policy for output tables.
 * <p>
 * {@code <State><Table>.csv}, e.g. {@code ColoradoB01001.csv}. The table index is
 * {@value #TABLE_INDEX_FILE}.
 */
public final class TableFileNamePolicy {

    public static final String TABLE_INDEX_FILE = "ACS All Tables.csv";

    private TableFileNamePolicy() {
    }

    public static String build(String state, String tableName) {
        String s = safePart(state, "UnknownState");
        String t = safePart(tableName, "UnknownTable");
        return limit(s + t, 180) + ".csv";
    }

    private static String safePart(String raw, String fallback) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) s = fallback;

        // Keep only filename-safe characters.
        s = s.replaceAll("[^a-zA-Z0-9._-]", "_");

        if (s.startsWith(".")) s = "_" + s.substring(1);

        String u = s.toUpperCase(Locale.ROOT);
        if (u.equals("CON") || u.equals("PRN") || u.equals("AUX") || u.equals("NUL")
                || u.matches("COM[1-9]") || u.matches("LPT[1-9]")) {
            s = "_" + s;
        }
        return s;
    }

    private static String limit(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max);
    }
}
