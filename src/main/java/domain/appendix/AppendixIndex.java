package domain.appendix;

import domain.error.MalformedMetadataException;
import domain.template.SequenceIds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Table name -> sequence/column-range index built from Appendix A of the Summary File
 * documentation.
 *
 * <p>Rows are added in workbook order. Several rows may share a table name when the table
 * spans more than one sequence; their order is kept. Every row is validated as it is added,
 * so a corrupt workbook fails before any state is processed.</p>
 */
public final class AppendixIndex {

    private final Map<String, TableDescriptor> tables;

    private AppendixIndex(Map<String, TableDescriptor> tables) {
        this.tables = Collections.unmodifiableMap(tables);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sequence slices of the table in appendix row order; empty when the name is unknown.
     */
    public List<SequenceRange> tablesOf(String name) {
        TableDescriptor d = tables.get(name);
        return d == null ? Collections.emptyList() : d.getSequences();
    }

    public TableDescriptor find(String name) {
        return tables.get(name);
    }

    public boolean contains(String name) {
        return tables.containsKey(name);
    }

    /** Unique table names in first-seen order. */
    public List<String> allTableNames() {
        return new ArrayList<>(tables.keySet());
    }

    public List<TableDescriptor> descriptors() {
        return new ArrayList<>(tables.values());
    }

    public int size() {
        return tables.size();
    }

    public static final class Builder {

        private final Map<String, String> titles = new LinkedHashMap<>();
        private final Map<String, String> restrictions = new LinkedHashMap<>();
        private final Map<String, List<SequenceRange>> ranges = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Add one appendix row.
         *
         * @param rowNumber 1-based workbook row, used in error messages only
         * @throws MalformedMetadataException when the sequence or range field is missing or the
         *                                    range is not {@code start-end} with {@code 1 <= start <= end}
         */
        public Builder addRow(int rowNumber, String name, String title, String restriction,
                              String sequence, String startEnd) {
            String tableName = trim(name);
            if (tableName.isEmpty()) {
                throw new MalformedMetadataException("row " + rowNumber + ": table name is blank");
            }
            String seq = trim(sequence);
            if (seq.isEmpty()) {
                throw new MalformedMetadataException("row " + rowNumber + " (" + tableName + "): sequence number is blank");
            }
            String range = trim(startEnd);
            if (range.isEmpty()) {
                throw new MalformedMetadataException("row " + rowNumber + " (" + tableName + "): start-end range is blank");
            }

            String sequenceId = SequenceIds.normalize(seq);
            if (!SequenceIds.isValid(sequenceId)) {
                throw new MalformedMetadataException(
                        "row " + rowNumber + " (" + tableName + "): sequence number is not 1-4 digits: '" + seq + "'");
            }
            SequenceRange parsed = parseRange(rowNumber, tableName, sequenceId, range);

            titles.putIfAbsent(tableName, trim(title));
            restrictions.putIfAbsent(tableName, trim(restriction));
            ranges.computeIfAbsent(tableName, k -> new ArrayList<>()).add(parsed);
            return this;
        }

        public AppendixIndex build() {
            Map<String, TableDescriptor> out = new LinkedHashMap<>();
            for (Map.Entry<String, List<SequenceRange>> e : ranges.entrySet()) {
                String n = e.getKey();
                out.put(n, new TableDescriptor(n, titles.get(n), restrictions.get(n), e.getValue()));
            }
            return new AppendixIndex(out);
        }

        private static SequenceRange parseRange(int rowNumber, String table, String seq, String range) {
            // split on the first '-' only
            int dash = range.indexOf('-');
            if (dash <= 0 || dash == range.length() - 1) {
                throw new MalformedMetadataException(
                        "row " + rowNumber + " (" + table + "): range is not start-end: '" + range + "'");
            }
            int start;
            int end;
            try {
                start = Integer.parseInt(range.substring(0, dash).trim());
                end = Integer.parseInt(range.substring(dash + 1).trim());
            } catch (NumberFormatException e) {
                throw new MalformedMetadataException(
                        "row " + rowNumber + " (" + table + "): range is not numeric: '" + range + "'", e);
            }
            if (start < 1 || end < start) {
                throw new MalformedMetadataException(
                        "row " + rowNumber + " (" + table + "): invalid range " + start + "-" + end);
            }
            return new SequenceRange(seq, start, end);
        }

        private static String trim(String s) {
            return s == null ? "" : s.trim();
        }
    }
}
