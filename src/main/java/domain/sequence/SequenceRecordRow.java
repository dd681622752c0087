package domain.sequence;

/**
 * One logical record of an estimate or margin file. Cells are positional (template order);
 * a {@code null} cell is missing.
 */
public final class SequenceRecordRow {

    private final String sequenceId;
    private final String logicalRecordNumber;
    private final String[] cells;

    public SequenceRecordRow(String sequenceId, String logicalRecordNumber, String[] cells) {
        this.sequenceId = sequenceId;
        this.logicalRecordNumber = logicalRecordNumber;
        this.cells = cells.clone();
    }

    public String getSequenceId() {
        return sequenceId;
    }

    public String getLogicalRecordNumber() {
        return logicalRecordNumber;
    }

    public int width() {
        return cells.length;
    }

    /** 0-based template position. */
    public String cell(int index) {
        return cells[index];
    }
}
