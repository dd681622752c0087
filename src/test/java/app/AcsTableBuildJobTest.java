package app;

import domain.appendix.AppendixIndex;
import domain.model.RunConfig;
import domain.output.TableSink;
import domain.report.BuildReport;
import domain.table.TableAssembler;
import domain.template.TemplateStore;
import infra.geography.GeographyCsvReader;
import infra.output.NullTableSink;
import infra.sequence.SequenceRecordReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
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

class AcsTableBuildJobTest {

    @TempDir
    Path tempDir;

    private AppendixIndex appendix;
    private TemplateStore templates;
    private final List<String> written = new ArrayList<>();
    private final TableSink sink = (state, table) -> written.add(state + table.getTableName());

    @BeforeEach
    void setUp() throws Exception {
        appendix = AppendixIndex.builder()
                .addRow(2, "B01001", "SEX BY AGE", "", "2", "7-8")
                .addRow(3, "B01002", "MEDIAN AGE", "", "3", "7-7")
                .addRow(4, "B01003", "TOTAL POPULATION", "", "3", "8-8")
                .build();

        Map<String, List<String>> t = new LinkedHashMap<>();
        t.put("0002", sequenceTemplate("Sex by age", 2));
        t.put("0003", sequenceTemplate("Median", 2));
        t.put(TemplateStore.GEO_KEY, GEO_TEMPLATE);
        templates = new TemplateStore(t);

        Map<String, byte[]> co = new LinkedHashMap<>();
        co.put("g20155co.csv", text(lines(
                geoLine("150", "0000101", "15000US080010078011"),
                geoLine("140", "0000050", "14000US08001007801"))));
        co.put("e20155co0002000.txt", text(lines(recordLine("0002", "0000101", "10", "4"))));
        co.put("m20155co0002000.txt", text(lines(recordLine("0002", "0000101", "1", "2"))));
        co.put("e20155co0003000.txt", text(lines(recordLine("0003", "0000101", "35.1", "."))));
        co.put("m20155co0003000.txt", text(lines(recordLine("0003", "0000101", "0.5", "."))));
        write(tempDir.resolve("Colorado_Tracts_Block_Groups_Only.zip"), zip(co));

        Map<String, byte[]> wy = new LinkedHashMap<>();
        wy.put("g20155wy.csv", text(lines(geoLine("150", "0000201", "15000US560010001001"))));
        wy.put("e20155wy0002000.txt", text(lines(recordLine("0002", "0000201", "7", "3"))));
        wy.put("m20155wy0002000.txt", text(lines(recordLine("0002", "0000201", "1", "1"))));
        wy.put("e20155wy0003000.txt", text(lines(recordLine("0003", "0000201", "40.0", "500"))));
        write(tempDir.resolve("Wyoming_Tracts_Block_Groups_Only.zip"), zip(wy));
    }

    private AcsTableBuildJob job(List<String> states) {
        RunConfig cfg = new RunConfig("2015", "150", states, Map.of("Colorado", "co", "Wyoming", "wy"),
                List.of(), tempDir, tempDir.resolve("out"), null, false, false, 1);
        return new AcsTableBuildJob(cfg, templates, new TableAssembler(appendix, templates), sink,
                new SequenceRecordReader(), new GeographyCsvReader());
    }

    @Test
    void should_skip_table_only_in_state_missing_its_margins() {
        BuildReport report = job(List.of("Colorado", "Wyoming")).run(appendix.allTableNames());

        assertEquals(2, report.state("Colorado").getBuilt());
        assertEquals(1, report.state("Colorado").getEmpty());
        assertEquals(0, report.state("Colorado").getSkipped());

        assertEquals(1, report.state("Wyoming").getBuilt());
        assertEquals(2, report.state("Wyoming").getSkipped());
        assertTrue(report.state("Wyoming").getSkippedTables().containsKey("B01002"));

        assertEquals(List.of("ColoradoB01001", "ColoradoB01002", "WyomingB01001"), written);
        assertEquals(0, report.exitStatus());
    }

    @Test
    void should_count_unknown_table_as_skipped() {
        BuildReport report = job(List.of("Colorado")).run(List.of("B01001", "B99999"));

        assertEquals(1, report.state("Colorado").getBuilt());
        assertEquals(1, report.state("Colorado").getSkipped());
    }

    @Test
    void should_fail_state_without_archive_and_continue() {
        BuildReport report = job(List.of("Utah", "Colorado")).run(List.of("B01001"));

        assertTrue(report.state("Utah").isFailed());
        assertEquals(0, report.state("Utah").total());
        assertEquals(1, report.state("Colorado").getBuilt());
        assertEquals(1, report.exitStatus());
    }

    @Test
    void dry_run_sink_should_still_count_built_tables() {
        RunConfig cfg = new RunConfig("2015", "150", List.of("Colorado"), Map.of("Colorado", "co"),
                List.of(), tempDir, tempDir.resolve("out"), null, false, true, 100);
        TableSink none = new NullTableSink();
        AcsTableBuildJob dry = new AcsTableBuildJob(cfg, templates, new TableAssembler(appendix, templates), none,
                new SequenceRecordReader(), new GeographyCsvReader());

        BuildReport report = dry.run(List.of("B01001"));

        assertEquals(1, report.state("Colorado").getBuilt());
    }
}
