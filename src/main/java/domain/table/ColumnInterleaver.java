package domain.table;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairwise zip-and-flatten of estimate and margin columns: [E1, M1, E2, M2, ...].
 */
public final class ColumnInterleaver {

    public static final String ESTIMATE_PREFIX = "E: ";
    public static final String MARGIN_PREFIX = "M: ";

    private ColumnInterleaver() {
    }

    public static <T> List<T> interleave(List<T> estimates, List<T> margins) {
        if (estimates.size() != margins.size()) {
            throw new IllegalArgumentException("estimate/margin width mismatch: "
                    + estimates.size() + " vs " + margins.size());
        }
        List<T> out = new ArrayList<>(estimates.size() * 2);
        for (int i = 0; i < estimates.size(); i++) {
            out.add(estimates.get(i));
            out.add(margins.get(i));
        }
        return out;
    }

    public static List<String> labels(List<String> columnNames) {
        List<String> e = new ArrayList<>(columnNames.size());
        List<String> m = new ArrayList<>(columnNames.size());
        for (String c : columnNames) {
            e.add(ESTIMATE_PREFIX + c);
            m.add(MARGIN_PREFIX + c);
        }
        return interleave(e, m);
    }
}
