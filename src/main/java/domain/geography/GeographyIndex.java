package domain.geography;

import domain.error.RecordFormatException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Geographic identifier -> logical record number for one state at one summary level.
 *
 * <p>Built once per state and joined against every sequence of every table without
 * re-parsing. An index with no matching rows is valid; joins against it are empty.</p>
 */
public final class GeographyIndex {

    public static final String SUMMARY_LEVEL_COLUMN = "Summary Level";
    public static final String RECORD_NUMBER_COLUMN = "Logical Record Number";
    public static final String GEO_IDENTIFIER_COLUMN = "Geographic Identifier";

    private final String summaryLevel;
    private final Map<String, String> lookup;
    private final Map<String, List<String>> byRecordNumber;

    private GeographyIndex(String summaryLevel, Map<String, String> lookup) {
        this.summaryLevel = summaryLevel;
        this.lookup = Collections.unmodifiableMap(lookup);

        Map<String, List<String>> inverse = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : lookup.entrySet()) {
            inverse.computeIfAbsent(e.getValue(), k -> new ArrayList<>(1)).add(e.getKey());
        }
        this.byRecordNumber = inverse;
    }

    /**
     * Filter parsed geography rows by summary level.
     *
     * @param template     geography template column names
     * @param rows         cells in template order, {@code null} for missing
     * @param summaryLevel compared as text, so "050" and "50" differ
     * @throws RecordFormatException when the template lacks one of the three required columns
     */
    public static GeographyIndex fromRows(List<String> template, Iterable<String[]> rows, String summaryLevel) {
        int levelIdx = requireColumn(template, SUMMARY_LEVEL_COLUMN);
        int lrnIdx = requireColumn(template, RECORD_NUMBER_COLUMN);
        int geoIdx = requireColumn(template, GEO_IDENTIFIER_COLUMN);

        Map<String, String> lookup = new LinkedHashMap<>();
        for (String[] row : rows) {
            String level = row[levelIdx];
            if (level == null || !level.equals(summaryLevel)) continue;

            String geoId = row[geoIdx];
            String lrn = row[lrnIdx];
            if (geoId == null || lrn == null) continue;
            lookup.put(geoId, lrn);
        }
        return new GeographyIndex(summaryLevel, lookup);
    }

    public static GeographyIndex of(String summaryLevel, Map<String, String> lookup) {
        return new GeographyIndex(summaryLevel, new LinkedHashMap<>(lookup));
    }

    private static int requireColumn(List<String> template, String name) {
        int idx = template.indexOf(name);
        if (idx < 0) {
            throw new RecordFormatException("geography template has no '" + name + "' column");
        }
        return idx;
    }

    public String getSummaryLevel() {
        return summaryLevel;
    }

    /** geoIdentifier -> logicalRecordNumber, in geography file order. */
    public Map<String, String> lookup() {
        return lookup;
    }

    /** Geographic identifiers sharing a logical record number; empty when unmatched. */
    public List<String> geoIdsFor(String logicalRecordNumber) {
        List<String> ids = byRecordNumber.get(logicalRecordNumber);
        return ids == null ? Collections.emptyList() : Collections.unmodifiableList(ids);
    }

    public boolean isEmpty() {
        return lookup.isEmpty();
    }

    public int size() {
        return lookup.size();
    }
}
