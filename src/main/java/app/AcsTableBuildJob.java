package app;

import cli.CliProgressMonitor;
import domain.error.AcsSourceException;
import domain.geography.GeographyIndex;
import domain.model.RunConfig;
import domain.output.TableSink;
import domain.report.BuildReport;
import domain.report.StateBuildSummary;
import domain.report.TableOutcome;
import domain.table.AssembledTable;
import domain.table.TableAssembler;
import domain.template.TemplateStore;
import infra.archive.StateArchive;
import infra.geography.GeographyCsvReader;
import infra.sequence.SequenceRecordReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * State loop / table loop of a run.
 *
 * <p>Errors are contained at the smallest unit they affect: a table failure is counted as
 * skipped for that state only, and a missing archive or geography file fails that state only.
 * Shared inputs (appendix, templates) are read-only here.</p>
 */
public final class AcsTableBuildJob {

    private final RunConfig config;
    private final TemplateStore templates;
    private final TableAssembler assembler;
    private final TableSink sink;
    private final SequenceRecordReader recordReader;
    private final GeographyCsvReader geographyReader;

    public AcsTableBuildJob(
            RunConfig config,
            TemplateStore templates,
            TableAssembler assembler,
            TableSink sink,
            SequenceRecordReader recordReader,
            GeographyCsvReader geographyReader
    ) {
        this.config = config;
        this.templates = templates;
        this.assembler = assembler;
        this.sink = sink;
        this.recordReader = recordReader;
        this.geographyReader = geographyReader;
    }

    public BuildReport run(List<String> tables) {
        BuildReport report = new BuildReport();
        for (String state : config.getStates()) {
            buildState(state, tables, report);
            System.out.println("[STAT] " + report.state(state).summaryLine());
        }
        return report;
    }

    void buildState(String state, List<String> tables, BuildReport report) {
        System.out.println("[STATE] Building tables for " + state);
        Path archivePath = config.getDataDir().resolve(config.stateArchiveFileName(state));

        StateArchive archive;
        try {
            archive = StateArchive.open(state, archivePath, recordReader, geographyReader);
        } catch (AcsSourceException e) {
            stateFailed(state, report, e);
            return;
        }

        try {
            GeographyIndex geography;
            try {
                geography = archive.readGeography(
                        templates.geographyTemplate(), config.getSummaryLevel(), config.stateCode(state));
            } catch (AcsSourceException e) {
                stateFailed(state, report, e);
                return;
            }
            System.out.println("[STATE] " + state + " geographies at summary level "
                    + config.getSummaryLevel() + " = " + geography.size());

            buildTables(state, archive, geography, tables, report);

        } finally {
            try {
                archive.close();
            } catch (IOException e) {
                System.out.println("[WARN] failed to close archive " + archivePath + ": " + e.getMessage());
            }
        }
    }

    private void buildTables(String state, StateArchive archive, GeographyIndex geography,
                             List<String> tables, BuildReport report) {
        StateBuildSummary summary = report.state(state);
        long loop0 = System.nanoTime();
        int total = tables.size();

        for (int i = 0; i < total; i++) {
            String table = tables.get(i);
            try {
                Optional<AssembledTable> built = assembler.assemble(table, geography, archive);
                if (built.isPresent()) {
                    sink.write(state, built.get());
                    report.record(state, table, TableOutcome.BUILT);
                } else {
                    report.record(state, table, TableOutcome.EMPTY);
                }
            } catch (RuntimeException e) {
                report.record(state, table, TableOutcome.SKIPPED, e.getClass().getSimpleName() + ": " + e.getMessage());
                System.out.println("[ERROR] " + state + " " + table + " skipped");
                System.out.println("        ex=" + e.getClass().getName() + ": " + e.getMessage());
            }

            if ((i + 1) % config.getLogEvery() == 0 || (i + 1) == total) {
                CliProgressMonitor.logProgress(state, i + 1, total, summary.getBuilt(), summary.getEmpty(),
                        summary.getSkipped(), loop0, table);
            }
        }
    }

    private static void stateFailed(String state, BuildReport report, AcsSourceException e) {
        System.out.println("[ERROR] Summary file error for " + state);
        System.out.println("        ex=" + e.getClass().getName() + ": " + e.getMessage());
        report.stateFailed(state, e.getMessage());
    }
}
