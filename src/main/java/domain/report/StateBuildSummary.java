package domain.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built / empty / skipped counters of one state.
 */
public final class StateBuildSummary {

    private final String state;
    private int built;
    private int empty;
    private int skipped;
    private String failure;
    private final Map<String, String> skippedTables = new LinkedHashMap<>();

    StateBuildSummary(String state) {
        this.state = state;
    }

    void record(String table, TableOutcome outcome, String detail) {
        switch (outcome) {
            case BUILT -> built++;
            case EMPTY -> empty++;
            case SKIPPED -> {
                skipped++;
                skippedTables.put(table, detail == null ? "" : detail);
            }
        }
    }

    void fail(String reason) {
        this.failure = reason == null ? "unknown" : reason;
    }

    public String getState() {
        return state;
    }

    public int getBuilt() {
        return built;
    }

    public int getEmpty() {
        return empty;
    }

    public int getSkipped() {
        return skipped;
    }

    public int total() {
        return built + empty + skipped;
    }

    /** State-level failure (archive or geography unavailable); {@code null} if none. */
    public String getFailure() {
        return failure;
    }

    public boolean isFailed() {
        return failure != null;
    }

    /** Skipped table name -> reason, in processing order. */
    public Map<String, String> getSkippedTables() {
        return Collections.unmodifiableMap(skippedTables);
    }

    public String summaryLine() {
        if (isFailed()) {
            return state + " tables: not built (" + failure + ")";
        }
        return state + " tables: saved " + built + ", dropped " + empty + " empty, skipped " + skipped;
    }

    @Override
    public String toString() {
        return summaryLine();
    }
}
