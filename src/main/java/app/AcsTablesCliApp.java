package app;

import cli.AcsTablesCli;
import cli.CliArgParser;
import domain.appendix.AppendixIndex;
import domain.error.AcsSourceException;
import domain.model.RunConfig;
import domain.output.TableFileNamePolicy;
import domain.output.TableSink;
import domain.report.BuildReport;
import domain.template.TemplateStore;
import infra.config.RunConfigLoader;
import infra.fetch.SourceFetcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link AcsTablesCli}). */
public final class AcsTablesCliApp {

    public static final int EXIT_FATAL = 2;

    private AcsTablesCliApp() {}

    public static int run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        RunConfig cfg = new RunConfigLoader().load(argv);

        System.out.println("==================================================");
        System.out.println("[START] ACS 5-year detailed tables");
        System.out.println("[CONF] year           = " + cfg.getYear());
        System.out.println("[CONF] summaryLevel   = " + cfg.getSummaryLevel());
        System.out.println("[CONF] states         = " + cfg.getStates());
        System.out.println("[CONF] tables         = " + (cfg.getTables().isEmpty() ? "(all)" : cfg.getTables()));
        System.out.println("[CONF] dataDir        = " + cfg.getDataDir().toAbsolutePath());
        System.out.println("[CONF] outDir         = " + cfg.getOutDir().toAbsolutePath());
        System.out.println("[CONF] report         = " + (cfg.getReport() == null ? "" : cfg.getReport().toAbsolutePath()));
        System.out.println("[CONF] download       = " + cfg.isDownload() + " (use --noDownload)");
        System.out.println("[CONF] dryRun         = " + cfg.isDryRun() + " (use --dryRun)");
        System.out.println("[CONF] logEvery       = " + cfg.getLogEvery());
        System.out.println("==================================================");

        try {
            Files.createDirectories(cfg.getDataDir());
            if (!cfg.isDryRun()) Files.createDirectories(cfg.getOutDir());
        } catch (IOException e) {
            System.out.println("[FATAL] cannot create data/output directories: " + e.getMessage());
            return EXIT_FATAL;
        }

        AcsTablesComponentsFactory factory = new AcsTablesComponentsFactory();

        if (cfg.isDownload()) {
            fetchSources(factory.createFetcher(), cfg);
        }

        BuildReport report;
        try {
            // ------------------------------------------------------------
            // shared inputs: any failure here ends the run
            // ------------------------------------------------------------
            long tApx0 = System.nanoTime();
            AppendixIndex appendix = factory.loadAppendix(cfg.getDataDir().resolve(cfg.appendixFileName()));
            System.out.println("[STEP1] Appendix loaded. tables=" + appendix.size() + ", elapsed=" + ms(tApx0) + "ms");

            if (!cfg.isDryRun()) {
                Path index = cfg.getOutDir().resolve(TableFileNamePolicy.TABLE_INDEX_FILE);
                factory.createTableIndexWriter().write(index, appendix);
                System.out.println("[STEP1] Table index written: " + index.toAbsolutePath());
            }

            long tTpl0 = System.nanoTime();
            TemplateStore templates = factory.loadTemplates(cfg.getDataDir().resolve(cfg.templatesFileName()));
            templates.geographyTemplate();
            System.out.println("[STEP2] Templates loaded. size=" + templates.size() + ", elapsed=" + ms(tTpl0) + "ms");

            List<String> tables = cfg.getTables().isEmpty() ? appendix.allTableNames() : cfg.getTables();
            for (String t : tables) {
                if (!appendix.contains(t)) {
                    System.out.println("[WARN] table not in appendix, will be skipped: " + t);
                }
            }

            // ------------------------------------------------------------
            // state loop
            // ------------------------------------------------------------
            TableSink sink = factory.createTableSink(cfg.isDryRun(), cfg.getOutDir());
            AcsTableBuildJob job = factory.createJob(cfg, appendix, templates, sink);

            long tLoop0 = System.nanoTime();
            System.out.println("[STEP3] building start. states=" + cfg.getStates().size() + ", tables=" + tables.size());
            report = job.run(tables);
            System.out.println("[STEP3] building done. elapsed=" + ms(tLoop0) + "ms");

        } catch (AcsSourceException e) {
            System.out.println("[FATAL] " + e.getClass().getSimpleName() + ": " + e.getMessage());
            if (e.getCause() != null) {
                System.out.println("        cause=" + e.getCause());
            }
            System.out.println("[FATAL] Exiting: required Summary File metadata is missing or corrupt.");
            return EXIT_FATAL;
        }

        System.out.println("[STAT] built=" + report.totalBuilt()
                + ", empty=" + report.totalEmpty()
                + ", skipped=" + report.totalSkipped());

        if (cfg.getReport() != null) {
            factory.createReportWriter().write(cfg.getReport(), report);
            System.out.println("[STAT] build report written: " + cfg.getReport().toAbsolutePath());
        }

        int status = report.exitStatus();
        System.out.println("==================================================");
        System.out.println("[DONE] exit=" + status + " totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return status;
    }

    private static void fetchSources(SourceFetcher fetcher, RunConfig cfg) {
        Path dataDir = cfg.getDataDir();
        fetcher.fetchIfMissing(cfg.appendixUrl(), dataDir.resolve(cfg.appendixFileName()));
        fetcher.fetchIfMissing(cfg.templatesUrl(), dataDir.resolve(cfg.templatesFileName()));
        for (String state : cfg.getStates()) {
            fetcher.fetchIfMissing(cfg.stateArchiveUrl(state), dataDir.resolve(cfg.stateArchiveFileName(state)));
        }
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
