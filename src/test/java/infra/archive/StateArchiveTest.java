package infra.archive;

import domain.error.SourceUnavailableException;
import domain.geography.GeographyIndex;
import domain.sequence.SequenceRowSet;
import infra.geography.GeographyCsvReader;
import infra.sequence.SequenceRecordReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static testsupport.SummaryFileFixtures.GEO_TEMPLATE;
import static testsupport.SummaryFileFixtures.geoLine;
import static testsupport.SummaryFileFixtures.lines;
import static testsupport.SummaryFileFixtures.recordLine;
import static testsupport.SummaryFileFixtures.sequenceTemplate;
import static testsupport.SummaryFileFixtures.text;
import static testsupport.SummaryFileFixtures.write;
import static testsupport.SummaryFileFixtures.zip;

class StateArchiveTest {

    private static final List<String> TEMPLATE = sequenceTemplate("Total", 2);

    @TempDir
    Path tempDir;

    private Path archive() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("g20155co.csv", text(lines(geoLine("150", "0000101", "15000US080010078011"))));
        members.put("e20155co0002000.txt", text(lines(recordLine("0002", "0000101", "10", "4"))));
        members.put("m20155co0002000.txt", text(lines(recordLine("0002", "0000101", "1", "2"))));
        members.put("e20155co0003000.txt", text(lines(recordLine("0003", "0000101", "5", "6"))));
        return write(tempDir.resolve("Colorado_Tracts_Block_Groups_Only.zip"), zip(members));
    }

    private static StateArchive open(Path p) {
        return StateArchive.open("Colorado", p, new SequenceRecordReader(), new GeographyCsvReader());
    }

    @Test
    void should_read_members_by_sequence_id_from_file_name() throws Exception {
        try (StateArchive a = open(archive())) {
            SequenceRowSet e = a.estimates("0002", TEMPLATE);
            SequenceRowSet m = a.margins("0002", TEMPLATE);

            assertEquals("10", e.row("0000101").cell(6));
            assertEquals("2", m.row("0000101").cell(7));
            assertTrue(a.hasSequence("0002"));
            assertFalse(a.hasSequence("0003"));
        }
    }

    @Test
    void should_report_missing_margin_member() throws Exception {
        try (StateArchive a = open(archive())) {
            SourceUnavailableException ex = assertThrows(SourceUnavailableException.class,
                    () -> a.margins("0003", TEMPLATE));
            assertTrue(ex.getMessage().contains("0003"), ex.getMessage());
        }
    }

    @Test
    void should_read_geography_member() throws Exception {
        try (StateArchive a = open(archive())) {
            assertEquals("g20155co.csv", a.geographyMember("co"));
            GeographyIndex geo = a.readGeography(GEO_TEMPLATE, "150", "co");
            assertEquals(List.of("15000US080010078011"), geo.geoIdsFor("0000101"));
        }
    }

    @Test
    void should_prefer_geography_member_matching_state_code() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("g20155ak.csv", text(lines(geoLine("150", "0000001", "15000US020100001001"))));
        members.put("g20155co.csv", text(lines(geoLine("150", "0000101", "15000US080010078011"))));
        Path p = write(tempDir.resolve("Mixed.zip"), zip(members));

        try (StateArchive a = open(p)) {
            assertEquals("g20155co.csv", a.geographyMember("CO"));
            assertEquals("g20155ak.csv", a.geographyMember(null));
        }
    }

    @Test
    void should_fail_when_archive_is_missing() {
        assertThrows(SourceUnavailableException.class, () -> open(tempDir.resolve("Nowhere.zip")));
    }

    @Test
    void should_fail_when_archive_has_no_geography() throws Exception {
        Map<String, byte[]> members = new LinkedHashMap<>();
        members.put("e20155co0002000.txt", text(lines(recordLine("0002", "0000101", "10", "4"))));
        Path p = write(tempDir.resolve("NoGeo.zip"), zip(members));

        try (StateArchive a = open(p)) {
            assertThrows(SourceUnavailableException.class, () -> a.geographyMember("co"));
        }
    }
}
