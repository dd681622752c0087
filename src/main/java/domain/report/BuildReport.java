package domain.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-state outcome counters for one run. Not thread-safe; one report per run loop.
 */
public final class BuildReport {

    private final Map<String, StateBuildSummary> states = new LinkedHashMap<>();

    public StateBuildSummary state(String state) {
        return states.computeIfAbsent(state, StateBuildSummary::new);
    }

    public void record(String state, String table, TableOutcome outcome) {
        record(state, table, outcome, "");
    }

    public void record(String state, String table, TableOutcome outcome, String detail) {
        state(state).record(table, outcome, detail);
    }

    public void stateFailed(String state, String reason) {
        state(state).fail(reason);
    }

    public List<StateBuildSummary> summaries() {
        return Collections.unmodifiableList(new ArrayList<>(states.values()));
    }

    public int totalBuilt() {
        int n = 0;
        for (StateBuildSummary s : states.values()) n += s.getBuilt();
        return n;
    }

    public int totalEmpty() {
        int n = 0;
        for (StateBuildSummary s : states.values()) n += s.getEmpty();
        return n;
    }

    public int totalSkipped() {
        int n = 0;
        for (StateBuildSummary s : states.values()) n += s.getSkipped();
        return n;
    }

    /** 1 when any state built zero tables (or nothing was processed), 0 otherwise. */
    public int exitStatus() {
        if (states.isEmpty()) return 1;
        for (StateBuildSummary s : states.values()) {
            if (s.getBuilt() == 0) return 1;
        }
        return 0;
    }
}
