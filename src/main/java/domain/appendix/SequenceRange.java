package domain.appendix;

import java.util.Objects;

/**
 * One (sequence, column range) slice of a table.
 *
 * <p>Columns are 1-based and inclusive, counted over the full sequence template
 * (including the leading file identification fields).</p>
 */
public final class SequenceRange {

    private final String sequenceId;
    private final int startColumn;
    private final int endColumn;

    public SequenceRange(String sequenceId, int startColumn, int endColumn) {
        if (sequenceId == null || sequenceId.length() != 4) {
            throw new IllegalArgumentException("sequenceId must be 4 characters: " + sequenceId);
        }
        if (startColumn < 1 || endColumn < startColumn) {
            throw new IllegalArgumentException("invalid column range " + startColumn + "-" + endColumn);
        }
        this.sequenceId = sequenceId;
        this.startColumn = startColumn;
        this.endColumn = endColumn;
    }

    public String getSequenceId() {
        return sequenceId;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndColumn() {
        return endColumn;
    }

    public int width() {
        return endColumn - startColumn + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SequenceRange that)) return false;
        return startColumn == that.startColumn
                && endColumn == that.endColumn
                && sequenceId.equals(that.sequenceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceId, startColumn, endColumn);
    }

    @Override
    public String toString() {
        return sequenceId + "[" + startColumn + "-" + endColumn + "]";
    }
}
