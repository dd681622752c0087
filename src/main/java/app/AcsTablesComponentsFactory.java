package app;

import domain.appendix.AppendixIndex;
import domain.model.RunConfig;
import domain.output.TableSink;
import domain.table.TableAssembler;
import domain.template.TemplateStore;
import infra.appendix.AppendixWorkbookLoader;
import infra.fetch.SourceFetcher;
import infra.geography.GeographyCsvReader;
import infra.output.BuildReportXlsxWriter;
import infra.output.CsvTableSink;
import infra.output.NullTableSink;
import infra.output.TableIndexCsvWriter;
import infra.sequence.SequenceRecordReader;
import infra.template.TemplateArchiveLoader;

import java.nio.file.Path;

/**
 * Object-assembly factory for {@link AcsTablesCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; object creation lives here.
 */
final class AcsTablesComponentsFactory {

    SourceFetcher createFetcher() {
        return new SourceFetcher();
    }

    AppendixIndex loadAppendix(Path appendixWorkbook) {
        return new AppendixWorkbookLoader().load(appendixWorkbook);
    }

    TemplateStore loadTemplates(Path templatesArchive) {
        return new TemplateArchiveLoader().load(templatesArchive);
    }

    TableIndexCsvWriter createTableIndexWriter() {
        return new TableIndexCsvWriter();
    }

    TableSink createTableSink(boolean dryRun, Path outDir) {
        if (dryRun) return new NullTableSink();
        return new CsvTableSink(outDir);
    }

    BuildReportXlsxWriter createReportWriter() {
        return new BuildReportXlsxWriter();
    }

    AcsTableBuildJob createJob(RunConfig config, AppendixIndex appendix, TemplateStore templates, TableSink sink) {
        return new AcsTableBuildJob(
                config,
                templates,
                new TableAssembler(appendix, templates),
                sink,
                new SequenceRecordReader(),
                new GeographyCsvReader()
        );
    }
}
