package infra.sequence;

import domain.error.RecordFormatException;
import domain.sequence.MissingValues;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Header-less, comma-separated Summary File records (ISO-8859-1).
 */
public final class SummaryFileCsv {

    public static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    static final CSVFormat FORMAT = CSVFormat.DEFAULT
            .builder()
            .setIgnoreEmptyLines(true)
            .build();

    private SummaryFileCsv() {
    }

    /**
     * Parse every record, checking its width against the template and mapping missing-value
     * markers to {@code null}. The stream is not closed.
     *
     * @throws RecordFormatException on a width mismatch
     * @throws IOException           when the stream cannot be read
     */
    public static List<String[]> readRows(InputStream in, int expectedWidth, String sourceName) throws IOException {
        Reader reader = new InputStreamReader(in, CHARSET);
        CSVParser parser = FORMAT.parse(reader);

        List<String[]> out = new ArrayList<>(1024);
        for (CSVRecord r : parser) {
            if (r.size() != expectedWidth) {
                throw new RecordFormatException(sourceName + " line " + parser.getCurrentLineNumber()
                        + ": " + r.size() + " fields, template has " + expectedWidth);
            }
            String[] cells = new String[expectedWidth];
            for (int i = 0; i < expectedWidth; i++) {
                cells[i] = MissingValues.normalize(r.get(i));
            }
            out.add(cells);
        }
        return out;
    }
}
