package infra.geography;

import domain.error.SourceUnavailableException;
import domain.geography.GeographyIndex;
import infra.sequence.SummaryFileCsv;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads the state geography file (g&lt;year&gt;5&lt;st&gt;.csv) into a {@link GeographyIndex}.
 */
public class GeographyCsvReader {

    public GeographyIndex read(InputStream in, List<String> geoTemplate, String summaryLevel, String sourceName) {
        List<String[]> rows;
        try {
            rows = SummaryFileCsv.readRows(in, geoTemplate.size(), sourceName);
        } catch (IOException e) {
            throw new SourceUnavailableException("Failed to read geography file " + sourceName, e);
        }
        return GeographyIndex.fromRows(geoTemplate, rows, summaryLevel);
    }
}
