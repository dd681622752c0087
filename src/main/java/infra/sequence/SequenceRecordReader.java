package infra.sequence;

import domain.error.RecordFormatException;
import domain.error.SourceUnavailableException;
import domain.sequence.SequenceRecordRow;
import domain.sequence.SequenceRowSet;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one estimate (e...) or margin (m...) sequence file against its template.
 *
 * <p>Only structural parsing happens here: values stay opaque text, "." and "-1" become
 * missing, and the SEQUENCE / LOGRECNO positions are renamed.</p>
 */
public class SequenceRecordReader {

    public SequenceRowSet read(InputStream in, String sequenceId, List<String> template, String sourceName) {
        if (template.size() <= SequenceRowSet.JOIN_KEY_POSITION) {
            throw new RecordFormatException("template for sequence " + sequenceId
                    + " is too narrow (" + template.size() + " columns)");
        }

        List<String[]> raw;
        try {
            raw = SummaryFileCsv.readRows(in, template.size(), sourceName);
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to read " + sourceName, e);
        }

        List<SequenceRecordRow> rows = new ArrayList<>(raw.size());
        for (String[] cells : raw) {
            String lrn = cells[SequenceRowSet.JOIN_KEY_POSITION];
            if (lrn == null) {
                throw new RecordFormatException(sourceName + ": record without logical record number");
            }
            rows.add(new SequenceRecordRow(sequenceId, lrn.trim(), cells));
        }
        return new SequenceRowSet(sequenceId, template, rows);
    }
}
