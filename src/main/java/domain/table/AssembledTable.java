package domain.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Output of {@link TableAssembler}: a GEOID column followed by interleaved estimate/margin
 * columns. Cells are opaque text; {@code null} is missing.
 */
public final class AssembledTable {

    public static final String GEOID_COLUMN = "GEOID";
    public static final int GEOID_LENGTH = 12;

    private final String tableName;
    private final List<String> dataColumns;
    private final List<Row> rows;

    public AssembledTable(String tableName, List<String> dataColumns, List<Row> rows) {
        this.tableName = tableName;
        this.dataColumns = Collections.unmodifiableList(new ArrayList<>(dataColumns));
        for (Row r : rows) {
            if (r.size() != dataColumns.size()) {
                throw new IllegalArgumentException("row width " + r.size()
                        + " does not match column count " + dataColumns.size() + " for " + r.getGeoId());
            }
        }
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    /**
     * Public GEOID: the last 12 characters of the Census geographic identifier
     * (the leading summary-level prefix is dropped).
     */
    public static String toGeoId(String geographicIdentifier) {
        if (geographicIdentifier.length() <= GEOID_LENGTH) return geographicIdentifier;
        return geographicIdentifier.substring(geographicIdentifier.length() - GEOID_LENGTH);
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> header() {
        List<String> h = new ArrayList<>(dataColumns.size() + 1);
        h.add(GEOID_COLUMN);
        h.addAll(dataColumns);
        return h;
    }

    public List<String> getDataColumns() {
        return dataColumns;
    }

    public List<Row> getRows() {
        return rows;
    }

    /** True when every cell outside GEOID is missing (including a table with no rows). */
    public boolean isEmpty() {
        for (Row r : rows) {
            if (r.hasValue()) return false;
        }
        return true;
    }

    public static final class Row {

        private final String geoId;
        private final String[] cells;

        public Row(String geoId, String[] cells) {
            this.geoId = geoId;
            this.cells = cells.clone();
        }

        public String getGeoId() {
            return geoId;
        }

        public int size() {
            return cells.length;
        }

        public String cell(int index) {
            return cells[index];
        }

        public List<String> cells() {
            return Collections.unmodifiableList(Arrays.asList(cells));
        }

        boolean hasValue() {
            for (String c : cells) {
                if (c != null) return true;
            }
            return false;
        }
    }
}
