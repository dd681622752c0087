package infra.sequence;

import domain.error.RecordFormatException;
import domain.sequence.SequenceRowSet;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static testsupport.SummaryFileFixtures.lines;
import static testsupport.SummaryFileFixtures.recordLine;
import static testsupport.SummaryFileFixtures.sequenceTemplate;
import static testsupport.SummaryFileFixtures.text;

class SequenceRecordReaderTest {

    private static final List<String> TEMPLATE = sequenceTemplate("Total", 3);

    @Test
    void should_rename_positional_columns_and_index_by_record_number() {
        String csv = lines(
                recordLine("0002", "0000101", "10", "4", "6"),
                recordLine("0002", "0000102", "20", "9", "11"));

        SequenceRowSet set = new SequenceRecordReader()
                .read(new ByteArrayInputStream(text(csv)), "0002", TEMPLATE, "e20155co0002000.txt");

        assertEquals(2, set.size());
        assertEquals("seq", set.getColumnNames().get(SequenceRowSet.SEQUENCE_POSITION));
        assertEquals("Logical Record Number", set.getColumnNames().get(SequenceRowSet.JOIN_KEY_POSITION));
        assertEquals("Total 1", set.getColumnNames().get(6));
        assertEquals("9", set.row("0000102").cell(7));
    }

    @Test
    void should_map_missing_markers_to_null_and_keep_other_values_as_text() {
        String csv = lines(recordLine("0002", "0000101", ".", "-1", "007"));

        SequenceRowSet set = new SequenceRecordReader()
                .read(new ByteArrayInputStream(text(csv)), "0002", TEMPLATE, "m20155co0002000.txt");

        assertNull(set.row("0000101").cell(6));
        assertNull(set.row("0000101").cell(7));
        assertEquals("007", set.row("0000101").cell(8));
    }

    @Test
    void should_fail_on_field_count_mismatch_with_line_number() {
        String csv = lines(
                recordLine("0002", "0000101", "10", "4", "6"),
                recordLine("0002", "0000102", "20", "9"));

        RecordFormatException ex = assertThrows(RecordFormatException.class, () -> new SequenceRecordReader()
                .read(new ByteArrayInputStream(text(csv)), "0002", TEMPLATE, "e20155co0002000.txt"));
        assertTrue(ex.getMessage().contains("line 2"), ex.getMessage());
    }

    @Test
    void should_read_latin1_text() {
        String csv = lines(recordLine("0002", "0000101", "Cañon City", "4", "6"));

        SequenceRowSet set = new SequenceRecordReader()
                .read(new ByteArrayInputStream(text(csv)), "0002", TEMPLATE, "e20155co0002000.txt");

        assertEquals("Cañon City", set.row("0000101").cell(6));
    }
}
