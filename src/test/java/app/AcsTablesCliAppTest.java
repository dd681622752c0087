package app;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static testsupport.SummaryFileFixtures.GEO_TEMPLATE;
import static testsupport.SummaryFileFixtures.geoLine;
import static testsupport.SummaryFileFixtures.lines;
import static testsupport.SummaryFileFixtures.recordLine;
import static testsupport.SummaryFileFixtures.sequenceTemplate;
import static testsupport.SummaryFileFixtures.templateWorkbook;
import static testsupport.SummaryFileFixtures.text;
import static testsupport.SummaryFileFixtures.workbook;
import static testsupport.SummaryFileFixtures.write;
import static testsupport.SummaryFileFixtures.zip;

class AcsTablesCliAppTest {

    private static final List<Object> APPENDIX_HEADER = List.of(
            "Table Number", "Table Title", "Subject Area", "Summary File Sequence Number", "Start and End Position");

    @TempDir
    Path tempDir;

    private Path dataDir;
    private Path outDir;

    @BeforeEach
    void setUp() throws Exception {
        dataDir = tempDir.resolve("ACS_data_2015");
        outDir = tempDir.resolve("tables");

        write(dataDir.resolve("ACS_2015_SF_5YR_Appendices.xls"), workbook(false, List.of(
                APPENDIX_HEADER,
                List.of("B01001", "SEX BY AGE", "Age-Sex", 2, "7-8"),
                List.of("B01002", "MEDIAN AGE", "Age-Sex", 3, "7-7"))));

        Map<String, byte[]> tpl = new LinkedHashMap<>();
        tpl.put("Seq2.xls", templateWorkbook(false, sequenceTemplate("Total", 2)));
        tpl.put("Seq3.xls", templateWorkbook(false, sequenceTemplate("Median", 1)));
        tpl.put("2015_SFGeoFileTemplate.xls", templateWorkbook(false, GEO_TEMPLATE));
        write(dataDir.resolve("2015_5yr_Summary_FileTemplates.zip"), zip(tpl));

        Map<String, byte[]> co = new LinkedHashMap<>();
        co.put("g20155co.csv", text(lines(
                geoLine("150", "0000101", "15000US080010078011"),
                geoLine("150", "0000102", "15000US080010078012"))));
        co.put("e20155co0002000.txt", text(lines(
                recordLine("0002", "0000101", "10", "4"),
                recordLine("0002", "0000102", "20", "-1"))));
        co.put("m20155co0002000.txt", text(lines(
                recordLine("0002", "0000101", "1", "2"),
                recordLine("0002", "0000102", "3", "."))));
        co.put("e20155co0003000.txt", text(lines(
                recordLine("0003", "0000101", "."),
                recordLine("0003", "0000102", "."))));
        co.put("m20155co0003000.txt", text(lines(
                recordLine("0003", "0000101", "."),
                recordLine("0003", "0000102", "."))));
        write(dataDir.resolve("Colorado_Tracts_Block_Groups_Only.zip"), zip(co));
    }

    private String[] args(String... extra) {
        List<String> a = new ArrayList<>(Arrays.asList(
                "--config=" + tempDir.resolve("absent.json"),
                "--dataDir=" + dataDir,
                "--outDir=" + outDir,
                "--states=Colorado",
                "--noDownload"));
        a.addAll(Arrays.asList(extra));
        return a.toArray(new String[0]);
    }

    @Test
    void should_build_tables_and_index_and_exit_zero() throws Exception {
        int exit = AcsTablesCliApp.run(args("--report=" + tempDir.resolve("report.xlsx")));

        assertEquals(0, exit);
        assertEquals("GEOID,E: Total 1,M: Total 1,E: Total 2,M: Total 2\n"
                        + "080010078011,10,1,4,2\n"
                        + "080010078012,20,3,,\n",
                Files.readString(outDir.resolve("ColoradoB01001.csv"), StandardCharsets.UTF_8));
        assertFalse(Files.exists(outDir.resolve("ColoradoB01002.csv")));
        assertEquals("name,title\nB01001,SEX BY AGE\nB01002,MEDIAN AGE\n",
                Files.readString(outDir.resolve("ACS All Tables.csv"), StandardCharsets.UTF_8));
        assertTrue(Files.exists(tempDir.resolve("report.xlsx")));
    }

    @Test
    void dry_run_should_write_nothing() {
        int exit = AcsTablesCliApp.run(args("--dryRun"));

        assertEquals(0, exit);
        assertFalse(Files.exists(outDir));
    }

    @Test
    void should_exit_one_when_a_state_builds_nothing() {
        int exit = AcsTablesCliApp.run(args("--states=Colorado,Wyoming"));

        assertEquals(1, exit);
        assertTrue(Files.exists(outDir.resolve("ColoradoB01001.csv")));
    }

    @Test
    void should_exit_two_on_malformed_appendix() throws Exception {
        write(dataDir.resolve("ACS_2015_SF_5YR_Appendices.xls"), workbook(false, List.of(
                APPENDIX_HEADER,
                Arrays.asList("B01001", "SEX BY AGE", "Age-Sex", null, "7-8"))));

        assertEquals(AcsTablesCliApp.EXIT_FATAL, AcsTablesCliApp.run(args()));
        assertFalse(Files.exists(outDir.resolve("ColoradoB01001.csv")));
    }

    @Test
    void should_exit_two_when_templates_are_missing() throws Exception {
        Files.delete(dataDir.resolve("2015_5yr_Summary_FileTemplates.zip"));

        assertEquals(AcsTablesCliApp.EXIT_FATAL, AcsTablesCliApp.run(args()));
    }
}
