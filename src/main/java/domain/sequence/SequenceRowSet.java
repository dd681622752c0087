package domain.sequence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All rows of one estimate or margin file, indexed by logical record number.
 *
 * <p>The positional fields SEQUENCE and LOGRECNO are renamed to {@link #SEQUENCE_COLUMN} and
 * {@link #JOIN_KEY_COLUMN}; every other column keeps its template name.</p>
 */
public final class SequenceRowSet {

    public static final int SEQUENCE_POSITION = 4;
    public static final int JOIN_KEY_POSITION = 5;

    public static final String SEQUENCE_COLUMN = "seq";
    public static final String JOIN_KEY_COLUMN = "Logical Record Number";

    private final String sequenceId;
    private final List<String> columnNames;
    private final Map<String, SequenceRecordRow> rows;

    public SequenceRowSet(String sequenceId, List<String> templateColumns, List<SequenceRecordRow> rows) {
        if (templateColumns.size() <= JOIN_KEY_POSITION) {
            throw new IllegalArgumentException("template for sequence " + sequenceId
                    + " has no LOGRECNO column (width=" + templateColumns.size() + ")");
        }
        this.sequenceId = sequenceId;
        this.columnNames = Collections.unmodifiableList(canonicalNames(templateColumns));

        Map<String, SequenceRecordRow> byKey = new LinkedHashMap<>();
        for (SequenceRecordRow r : rows) {
            byKey.put(r.getLogicalRecordNumber(), r);
        }
        this.rows = Collections.unmodifiableMap(byKey);
    }

    private static List<String> canonicalNames(List<String> template) {
        List<String> names = new ArrayList<>(template);
        names.set(SEQUENCE_POSITION, SEQUENCE_COLUMN);
        names.set(JOIN_KEY_POSITION, JOIN_KEY_COLUMN);
        return names;
    }

    public String getSequenceId() {
        return sequenceId;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    /** Rows keyed by logical record number, in file order. */
    public Map<String, SequenceRecordRow> rows() {
        return rows;
    }

    public SequenceRecordRow row(String logicalRecordNumber) {
        return rows.get(logicalRecordNumber);
    }

    public int size() {
        return rows.size();
    }
}
