package infra.geography;

import domain.error.RecordFormatException;
import domain.geography.GeographyIndex;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;

import static org.junit.jupiter.api.Assertions.*;
import static testsupport.SummaryFileFixtures.GEO_TEMPLATE;
import static testsupport.SummaryFileFixtures.geoLine;
import static testsupport.SummaryFileFixtures.lines;
import static testsupport.SummaryFileFixtures.text;

class GeographyCsvReaderTest {

    @Test
    void should_index_block_groups_and_ignore_other_levels() {
        String csv = lines(
                geoLine("040", "0000001", "04000US08"),
                geoLine("140", "0000050", "14000US08001007801"),
                geoLine("150", "0000101", "15000US080010078011"),
                geoLine("150", "0000102", "15000US080010078012"));

        GeographyIndex idx = new GeographyCsvReader()
                .read(new ByteArrayInputStream(text(csv)), GEO_TEMPLATE, "150", "g20155co.csv");

        assertEquals(2, idx.size());
        assertEquals("0000101", idx.lookup().get("15000US080010078011"));
        assertEquals("150", idx.getSummaryLevel());
    }

    @Test
    void should_fail_when_row_is_narrower_than_template() {
        String csv = lines("ACSSF,CO,150,00,0000101");

        assertThrows(RecordFormatException.class, () -> new GeographyCsvReader()
                .read(new ByteArrayInputStream(text(csv)), GEO_TEMPLATE, "150", "g20155co.csv"));
    }
}
