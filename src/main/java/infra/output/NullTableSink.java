package infra.output;

import domain.output.TableSink;
import domain.table.AssembledTable;

/**
 * No-op implementation (--dryRun).
 */
public final class NullTableSink implements TableSink {
    @Override
    public void write(String state, AssembledTable table) {
        // intentionally no-op
    }
}
