package domain.appendix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named Detailed Table and the sequence slices it is built from, in appendix order.
 */
public final class TableDescriptor {

    private final String name;
    private final String title;
    private final String restriction;
    private final List<SequenceRange> sequences;

    public TableDescriptor(String name, String title, String restriction, List<SequenceRange> sequences) {
        this.name = name;
        this.title = title == null ? "" : title;
        this.restriction = restriction == null ? "" : restriction;
        this.sequences = Collections.unmodifiableList(new ArrayList<>(sequences));
    }

    public String getName() {
        return name;
    }

    public String getTitle() {
        return title;
    }

    /** Appendix restriction flag, kept verbatim (usually blank). */
    public String getRestriction() {
        return restriction;
    }

    public List<SequenceRange> getSequences() {
        return sequences;
    }

    @Override
    public String toString() {
        return "TableDescriptor{" +
                "name='" + name + '\'' +
                ", sequences=" + sequences +
                '}';
    }
}
