package domain.table;

import domain.sequence.SequenceRowSet;

import java.util.List;

/**
 * Supplies the parsed estimate and margin files of one state, per sequence.
 *
 * <p>Implementations throw {@link domain.error.SourceUnavailableException} when a file is
 * absent and {@link domain.error.RecordFormatException} when it does not fit the template.</p>
 */
public interface SequenceSource {

    SequenceRowSet estimates(String sequenceId, List<String> template);

    SequenceRowSet margins(String sequenceId, List<String> template);
}
