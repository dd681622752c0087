package infra.config;

import cli.CliArgParser;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import domain.model.RunConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves {@link RunConfig}: built-in defaults, then config.json, then command-line options.
 *
 * <p>An absent or unreadable config.json is not an error; defaults are used.</p>
 */
public final class RunConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "config.json";

    private final ObjectMapper mapper = new ObjectMapper();

    /** config.json shape. Unknown keys are ignored. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConfigFile {
        public String year;
        public String summaryLevel;
        public List<String> states;
        public Map<String, String> stateCodes;
        public List<String> tables;
        public String dataDir;
        public String outDir;
        public String report;
        public Boolean download;
        public Integer logEvery;
    }

    public RunConfig load(Map<String, String> argv) {
        String configRaw = argv == null ? null : argv.get("config");
        Path configPath = Path.of(configRaw == null || configRaw.isBlank() ? DEFAULT_CONFIG_FILE : configRaw.trim());
        return load(readConfigFile(configPath), argv);
    }

    ConfigFile readConfigFile(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            System.out.println("[WARN] config file not found, using defaults: " + configPath.toAbsolutePath());
            return new ConfigFile();
        }
        try {
            ConfigFile cf = mapper.readValue(configPath.toFile(), ConfigFile.class);
            System.out.println("[INIT] config loaded: " + configPath.toAbsolutePath());
            return cf == null ? new ConfigFile() : cf;
        } catch (IOException e) {
            System.out.println("[WARN] config file unreadable, using defaults: " + configPath.toAbsolutePath()
                    + " (" + e.getMessage() + ")");
            return new ConfigFile();
        }
    }

    RunConfig load(ConfigFile cf, Map<String, String> argv) {
        Map<String, String> args = argv == null ? Collections.emptyMap() : argv;

        String year = firstNonBlank(args.get("year"), cf.year, RunConfig.DEFAULT_YEAR);
        String summaryLevel = firstNonBlank(args.get("summaryLevel"), cf.summaryLevel, RunConfig.DEFAULT_SUMMARY_LEVEL);

        List<String> states = splitList(args.get("states"));
        if (states.isEmpty()) states = nonBlank(cf.states);
        if (states.isEmpty()) states = RunConfig.DEFAULT_STATES;

        List<String> tables = splitList(args.get("tables"));
        if (tables.isEmpty()) tables = nonBlank(cf.tables);

        Map<String, String> stateCodes = new LinkedHashMap<>(StateCodeCatalog.load());
        if (cf.stateCodes != null) stateCodes.putAll(cf.stateCodes);

        Path dataDir = Path.of(firstNonBlank(args.get("dataDir"), cf.dataDir, "ACS_data_" + year));
        String outRaw = firstNonBlank(args.get("outDir"), cf.outDir, null);
        Path outDir = outRaw == null ? dataDir.resolve("ACS_tables") : Path.of(outRaw);

        String reportRaw = firstNonBlank(args.get("report"), cf.report, null);
        Path report = reportRaw == null ? null : Path.of(reportRaw);

        boolean download = cf.download == null || cf.download;
        if (CliArgParser.flag(args, "noDownload")) download = false;
        boolean dryRun = CliArgParser.flag(args, "dryRun");

        int logEvery = CliArgParser.parseInt(args.get("logEvery"), cf.logEvery == null ? 100 : cf.logEvery);

        return new RunConfig(year, summaryLevel, states, stateCodes, tables,
                dataDir, outDir, report, download, dryRun, logEvery);
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }

    private static List<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) return Collections.emptyList();
        List<String> out = new ArrayList<>();
        for (String s : raw.split(",")) {
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) return Collections.emptyList();
        List<String> out = new ArrayList<>(values.size());
        for (String s : values) {
            if (s != null && !s.isBlank()) out.add(s.trim());
        }
        return out;
    }
}
