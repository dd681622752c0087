package domain.output;

import domain.table.AssembledTable;

/** Receives assembled tables of one state. Only non-empty tables are passed in. */
public interface TableSink {
    void write(String state, AssembledTable table);
}
