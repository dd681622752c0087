package domain.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved run configuration (defaults < config.json < command line).
 *
 * <p>Also derives the Census file names and URLs for the release year.</p>
 */
public final class RunConfig {

    public static final String DEFAULT_YEAR = "2015";
    public static final String DEFAULT_SUMMARY_LEVEL = "150"; // block group
    public static final List<String> DEFAULT_STATES = List.of("Colorado");

    public static final String STATE_ARCHIVE_SUFFIX = "_Tracts_Block_Groups_Only.zip";
    private static final String BASE_URL = "https://www2.census.gov/programs-surveys/acs/summary_file/";

    private final String year;
    private final String summaryLevel;
    private final List<String> states;
    private final Map<String, String> stateCodes;
    private final List<String> tables;
    private final Path dataDir;
    private final Path outDir;
    private final Path report;
    private final boolean download;
    private final boolean dryRun;
    private final int logEvery;

    public RunConfig(
            String year,
            String summaryLevel,
            List<String> states,
            Map<String, String> stateCodes,
            List<String> tables,
            Path dataDir,
            Path outDir,
            Path report,
            boolean download,
            boolean dryRun,
            int logEvery
    ) {
        this.year = year;
        this.summaryLevel = summaryLevel;
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.stateCodes = Collections.unmodifiableMap(new LinkedHashMap<>(stateCodes));
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        this.dataDir = dataDir;
        this.outDir = outDir;
        this.report = report;
        this.download = download;
        this.dryRun = dryRun;
        this.logEvery = Math.max(1, logEvery);
    }

    public String getYear() {
        return year;
    }

    public String getSummaryLevel() {
        return summaryLevel;
    }

    public List<String> getStates() {
        return states;
    }

    public Map<String, String> getStateCodes() {
        return stateCodes;
    }

    /** Two-letter lower-case code, or {@code null} when unknown. */
    public String stateCode(String state) {
        return stateCodes.get(state);
    }

    /** Requested table names; empty means every table in the appendix. */
    public List<String> getTables() {
        return tables;
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getOutDir() {
        return outDir;
    }

    /** Optional build report workbook; {@code null} when not requested. */
    public Path getReport() {
        return report;
    }

    public boolean isDownload() {
        return download;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public int getLogEvery() {
        return logEvery;
    }

    // --- derived Census names -------------------------------------------------

    public String appendixFileName() {
        return "ACS_" + year + "_SF_5YR_Appendices.xls";
    }

    public String templatesFileName() {
        return year + "_5yr_Summary_FileTemplates.zip";
    }

    public String stateArchiveFileName(String state) {
        return state + STATE_ARCHIVE_SUFFIX;
    }

    public String baseUrl() {
        return BASE_URL + year;
    }

    public String appendixUrl() {
        return baseUrl() + "/documentation/tech_docs/" + appendixFileName();
    }

    public String templatesUrl() {
        return baseUrl() + "/data/" + templatesFileName();
    }

    public String stateArchiveUrl(String state) {
        return baseUrl() + "/data/5_year_by_state/" + stateArchiveFileName(state);
    }
}
