package domain.table;

import domain.appendix.AppendixIndex;
import domain.appendix.SequenceRange;
import domain.error.RecordFormatException;
import domain.geography.GeographyIndex;
import domain.sequence.SequenceRecordRow;
import domain.sequence.SequenceRowSet;
import domain.template.TemplateStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds one Detailed Table for one state.
 *
 * <p>For every sequence slice of the table (appendix order): read estimates and margins,
 * inner-join both on the logical record number against the geography index, keep the
 * 1-based inclusive column range, label and interleave, then concatenate the sequences
 * side by side on the geographic identifier.</p>
 *
 * <p>Any failure while reading a sequence propagates and aborts the whole table, so a table
 * is never emitted with part of its sequences.</p>
 */
public final class TableAssembler {

    private final AppendixIndex appendix;
    private final TemplateStore templates;

    public TableAssembler(AppendixIndex appendix, TemplateStore templates) {
        this.appendix = appendix;
        this.templates = templates;
    }

    /**
     * @return the table, or empty when every non-GEOID cell is missing
     * @throws IllegalArgumentException when the table name is not in the appendix
     */
    public Optional<AssembledTable> assemble(String tableName, GeographyIndex geography, SequenceSource source) {
        AssembledTable table = build(tableName, geography, source);
        return table.isEmpty() ? Optional.empty() : Optional.of(table);
    }

    /** Same as {@link #assemble} but returns empty tables too. */
    public AssembledTable build(String tableName, GeographyIndex geography, SequenceSource source) {
        List<SequenceRange> ranges = appendix.tablesOf(tableName);
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("table not found in appendix: " + tableName);
        }

        List<SequenceBlock> blocks = new ArrayList<>(ranges.size());
        for (SequenceRange range : ranges) {
            blocks.add(assembleSequence(range, geography, source));
        }
        return concatenate(tableName, blocks);
    }

    private SequenceBlock assembleSequence(SequenceRange range, GeographyIndex geography, SequenceSource source) {
        String seq = range.getSequenceId();
        List<String> template = templates.templateFor(seq);
        if (range.getEndColumn() > template.size()) {
            throw new RecordFormatException("column range " + range + " exceeds template width " + template.size());
        }

        SequenceRowSet estimates = source.estimates(seq, template);
        SequenceRowSet margins = source.margins(seq, template);

        Map<String, String[]> e = joinAndSlice(estimates, geography, range);
        Map<String, String[]> m = joinAndSlice(margins, geography, range);

        List<String> names = estimates.getColumnNames()
                .subList(range.getStartColumn() - 1, range.getEndColumn());
        List<String> columns = ColumnInterleaver.labels(names);

        Map<String, String[]> rows = new LinkedHashMap<>();
        for (String geoId : unionKeys(List.of(e.keySet(), m.keySet()))) {
            String[] ev = e.getOrDefault(geoId, new String[range.width()]);
            String[] mv = m.getOrDefault(geoId, new String[range.width()]);
            List<String> cells = ColumnInterleaver.interleave(Arrays.asList(ev), Arrays.asList(mv));
            rows.put(geoId, cells.toArray(new String[0]));
        }
        return new SequenceBlock(columns, rows);
    }

    /**
     * Inner join on logical record number; records without a geography match are dropped.
     * Result is keyed by the full geographic identifier, in record file order.
     */
    static Map<String, String[]> joinAndSlice(SequenceRowSet rowSet, GeographyIndex geography, SequenceRange range) {
        int from = range.getStartColumn() - 1;
        int to = range.getEndColumn();

        Map<String, String[]> out = new LinkedHashMap<>();
        for (SequenceRecordRow row : rowSet.rows().values()) {
            List<String> geoIds = geography.geoIdsFor(row.getLogicalRecordNumber());
            if (geoIds.isEmpty()) continue;

            String[] slice = new String[to - from];
            for (int i = from; i < to; i++) {
                slice[i - from] = row.cell(i);
            }
            for (String geoId : geoIds) {
                out.put(geoId, slice);
            }
        }
        return out;
    }

    private static AssembledTable concatenate(String tableName, List<SequenceBlock> blocks) {
        List<String> columns = new ArrayList<>();
        List<Set<String>> keySets = new ArrayList<>(blocks.size());
        for (SequenceBlock b : blocks) {
            columns.addAll(b.columns);
            keySets.add(b.rows.keySet());
        }

        List<AssembledTable.Row> rows = new ArrayList<>();
        for (String geoIdentifier : unionKeys(keySets)) {
            String[] cells = new String[columns.size()];
            int offset = 0;
            for (SequenceBlock b : blocks) {
                String[] part = b.rows.get(geoIdentifier);
                if (part != null) {
                    System.arraycopy(part, 0, cells, offset, part.length);
                }
                offset += b.columns.size();
            }
            rows.add(new AssembledTable.Row(AssembledTable.toGeoId(geoIdentifier), cells));
        }
        return new AssembledTable(tableName, columns, rows);
    }

    private static Set<String> unionKeys(List<Set<String>> keySets) {
        Set<String> keys = new LinkedHashSet<>();
        for (Set<String> s : keySets) keys.addAll(s);
        return keys;
    }

    private static final class SequenceBlock {

        private final List<String> columns;
        private final Map<String, String[]> rows;

        private SequenceBlock(List<String> columns, Map<String, String[]> rows) {
            this.columns = columns;
            this.rows = rows;
        }
    }
}
